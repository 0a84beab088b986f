package ai.treemetrics.analyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Iterative traversal helpers over {@link SyntaxNode}. Deeply nested input must not exhaust the call stack, so nothing
 * here recurses.
 */
public final class ASTTraversalUtils {
    private ASTTraversalUtils() {}

    /**
     * Visits {@code root} and its descendants in source order. Children of a node are only visited when
     * {@code descend} accepts that node; the root is always descended into.
     */
    public static void preOrder(SyntaxNode root, Predicate<SyntaxNode> descend, Consumer<SyntaxNode> visitor) {
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            visitor.accept(node);
            if (node != root && !descend.test(node)) {
                continue;
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(node.child(i));
            }
        }
    }

    /** Finds all nodes matching the predicate, in source order. */
    public static List<SyntaxNode> findAll(SyntaxNode root, Predicate<SyntaxNode> predicate) {
        var results = new ArrayList<SyntaxNode>();
        preOrder(root, n -> true, n -> {
            if (predicate.test(n)) {
                results.add(n);
            }
        });
        return results;
    }

    /** Finds all nodes of a specific kind. */
    public static List<SyntaxNode> findAllByKind(SyntaxNode root, String kind) {
        return findAll(root, n -> kind.equals(n.kind()));
    }

    public static Optional<SyntaxNode> firstChildOfKind(SyntaxNode node, String kind) {
        for (int i = 0; i < node.childCount(); i++) {
            var child = node.child(i);
            if (kind.equals(child.kind())) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public static boolean hasChildOfKind(SyntaxNode node, String kind) {
        return firstChildOfKind(node, kind).isPresent();
    }

    /** Text of the given field of {@code node}, trimmed. */
    public static Optional<String> fieldText(SyntaxNode node, String fieldName) {
        return node.childByFieldName(fieldName).map(n -> n.text().trim());
    }
}
