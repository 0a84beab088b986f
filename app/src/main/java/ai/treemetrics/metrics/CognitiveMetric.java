package ai.treemetrics.metrics;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.space.SpaceScope;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cognitive complexity. Branches, loops and switches cost {@code 1 + nesting} and nest their bodies; else-if and else
 * cost 1. Closures nested in a function are scored as part of it, one level deeper. Each maximal boolean expression
 * costs 1 plus one per change of operator kind.
 */
final class CognitiveMetric {
    private static final Set<String> LOGICAL_EXPRESSIONS = Set.of("binary_expression", "boolean_operator");
    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "and", "or");
    private static final String PARENTHESIZED = "parenthesized_expression";
    private static final long NO_EXPRESSION = -1L;

    /** {@code logicalRoot} is the key of the outermost boolean expression enclosing the node, or -1. */
    private record Frame(SyntaxNode node, int nesting, long logicalRoot) {}

    private CognitiveMetric() {}

    static double compute(SpaceScope scope, LanguageClassifier classifier) {
        boolean includeClosures = scope.kind().isFunctionLike();
        long score = 0;
        // root of each boolean expression -> operators in source order
        Map<Long, List<String>> sequences = new LinkedHashMap<>();

        var stack = new ArrayDeque<Frame>();
        pushChildren(stack, scope.node(), 0, NO_EXPRESSION);
        while (!stack.isEmpty()) {
            var frame = stack.pop();
            var node = frame.node();
            int nesting = frame.nesting();
            int childNesting = nesting;
            long childRoot = NO_EXPRESSION;
            if (isLogicalExpression(node)) {
                childRoot = frame.logicalRoot() == NO_EXPRESSION ? key(node) : frame.logicalRoot();
            } else if (PARENTHESIZED.equals(node.kind())) {
                childRoot = frame.logicalRoot();
            }

            switch (classifier.classify(node)) {
                case FUNCTION_BOUNDARY -> {
                    continue;
                }
                case CLOSURE_BOUNDARY -> {
                    if (!includeClosures) {
                        continue;
                    }
                    childNesting = nesting + 1;
                }
                case BRANCH, LOOP, SWITCH -> {
                    score += 1 + nesting;
                    childNesting = nesting + 1;
                }
                case ALTERNATIVE, ELSE -> score += 1;
                case LOGICAL_AND_OR -> sequences
                        .computeIfAbsent(
                                frame.logicalRoot() == NO_EXPRESSION ? key(node) : frame.logicalRoot(),
                                k -> new ArrayList<>())
                        .add(node.kind());
                default -> {}
            }
            pushChildren(stack, node, childNesting, childRoot);
        }

        for (var operators : sequences.values()) {
            score += 1;
            for (int i = 1; i < operators.size(); i++) {
                if (!operators.get(i).equals(operators.get(i - 1))) {
                    score++;
                }
            }
        }
        return score;
    }

    private static void pushChildren(ArrayDeque<Frame> stack, SyntaxNode node, int nesting, long logicalRoot) {
        for (int i = node.childCount() - 1; i >= 0; i--) {
            stack.push(new Frame(node.child(i), nesting, logicalRoot));
        }
    }

    private static long key(SyntaxNode node) {
        return ((long) node.startByte() << 32) | (node.endByte() & 0xffffffffL);
    }

    /** A binary expression joined by {@code &&}/{@code ||}, or a Python boolean operator. */
    private static boolean isLogicalExpression(SyntaxNode node) {
        return LOGICAL_EXPRESSIONS.contains(node.kind())
                && node.childByFieldName("operator")
                        .map(op -> LOGICAL_OPERATORS.contains(op.kind()))
                        .orElse(false);
    }
}
