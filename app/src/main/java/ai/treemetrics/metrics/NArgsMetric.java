package ai.treemetrics.metrics;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import java.util.ArrayDeque;
import java.util.List;

/** Number of parameters declared by a function or closure boundary. */
final class NArgsMetric {
    /** {@code parameter} holds the lone unparenthesized parameter of a TypeScript arrow function. */
    private static final List<String> PARAMETER_FIELDS = List.of("parameters", "parameter");

    private NArgsMetric() {}

    static long count(SyntaxNode boundary, LanguageClassifier classifier) {
        long total = 0;
        for (var field : PARAMETER_FIELDS) {
            var list = boundary.childByFieldName(field);
            if (list.isPresent()) {
                total += countParameters(list.get(), classifier);
            }
        }
        return total;
    }

    private static long countParameters(SyntaxNode list, LanguageClassifier classifier) {
        long count = 0;
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(list);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            var category = classifier.classify(node);
            if (category == SemanticCategory.PARAMETER) {
                count++;
                continue;
            }
            if (node != list && category.isSpaceBoundary()) {
                continue;
            }
            var type = node.childByFieldName("type");
            for (int i = node.childCount() - 1; i >= 0; i--) {
                var child = node.child(i);
                // names inside a parameter's own function type belong to that type
                if (type.isPresent() && type.get().sameNode(child)) {
                    continue;
                }
                stack.push(child);
            }
        }
        return count;
    }
}
