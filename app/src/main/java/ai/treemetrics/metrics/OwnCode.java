package ai.treemetrics.metrics;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import java.util.ArrayDeque;

/** Walks the code that belongs to a space itself. */
final class OwnCode {

    interface Visitor {
        void visit(SyntaxNode node, SemanticCategory category);
    }

    private OwnCode() {}

    /**
     * Visits {@code root} and its descendants in source order, skipping the subtrees of nested function and closure
     * boundaries. With {@code stopAtAllBoundaries} nested type and namespace subtrees are skipped as well.
     */
    static void walk(SyntaxNode root, LanguageClassifier classifier, boolean stopAtAllBoundaries, Visitor visitor) {
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(root);
        boolean first = true;
        while (!stack.isEmpty()) {
            var node = stack.pop();
            var category = classifier.classify(node);
            if (!first) {
                boolean nested = stopAtAllBoundaries ? category.isSpaceBoundary() : category.isFunctionLike();
                if (nested) {
                    continue;
                }
            }
            first = false;
            visitor.visit(node, category);
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(node.child(i));
            }
        }
    }
}
