package ai.treemetrics.space;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.ParsedSource;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.analyzer.space.SpaceKind;
import java.util.ArrayDeque;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Partitions a syntax tree into nested spaces in one depth-first pass. Traversal uses an explicit stack whose frames
 * carry the space that owns the node.
 */
public final class SpaceTreeBuilder {
    private static final Logger logger = LogManager.getLogger(SpaceTreeBuilder.class);

    private record Frame(SyntaxNode node, SpaceScope owner) {}

    private SpaceTreeBuilder() {}

    public static SpaceTree build(ParsedSource source, LanguageClassifier classifier, String unitName) {
        var root = source.root();
        var unit = new SpaceScope(SpaceKind.UNIT, unitName, root, 0, source.content().byteLength());

        var stack = new ArrayDeque<Frame>();
        pushChildren(stack, root, unit);
        while (!stack.isEmpty()) {
            var frame = stack.pop();
            var node = frame.node();
            var owner = frame.owner();

            var kind = spaceKindOf(classifier.classify(node));
            if (kind != null) {
                var scope =
                        new SpaceScope(kind, classifier.spaceName(node), node, node.startByte(), node.endByte());
                owner.addChild(scope);
                owner = scope;
            }
            pushChildren(stack, node, owner);
        }

        boolean degraded = source.degraded();
        if (degraded) {
            logger.debug("Built space tree for {} from a tree with syntax errors", unitName);
        }
        return new SpaceTree(source, classifier, unit, degraded);
    }

    private static void pushChildren(ArrayDeque<Frame> stack, SyntaxNode node, SpaceScope owner) {
        for (int i = node.childCount() - 1; i >= 0; i--) {
            stack.push(new Frame(node.child(i), owner));
        }
    }

    static @Nullable SpaceKind spaceKindOf(SemanticCategory category) {
        return switch (category) {
            case FUNCTION_BOUNDARY -> SpaceKind.FUNCTION;
            case CLOSURE_BOUNDARY -> SpaceKind.CLOSURE;
            case TYPE_BOUNDARY -> SpaceKind.TYPE;
            case NAMESPACE_BOUNDARY -> SpaceKind.NAMESPACE;
            default -> null;
        };
    }
}
