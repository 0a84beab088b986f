package ai.treemetrics.metrics;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Category counts and Halstead token multisets of one space's own code, gathered in a single walk. */
final class OwnCodeCounts {
    private final Map<SemanticCategory, Long> categories = new EnumMap<>(SemanticCategory.class);
    private final SortedMap<String, Long> operators = new TreeMap<>();
    private final SortedMap<String, Long> operands = new TreeMap<>();
    private long statements;

    private OwnCodeCounts() {}

    static OwnCodeCounts scan(SyntaxNode root, LanguageClassifier classifier) {
        var counts = new OwnCodeCounts();
        OwnCode.walk(root, classifier, false, (node, category) -> counts.add(node, category, classifier));
        return counts;
    }

    private void add(SyntaxNode node, SemanticCategory category, LanguageClassifier classifier) {
        categories.merge(category, 1L, Long::sum);
        switch (category) {
            case OPERATOR, LOGICAL_AND_OR -> operators.merge(operatorKey(node.kind()), 1L, Long::sum);
            case OPERAND, STRING_LITERAL -> operands.merge(node.text(), 1L, Long::sum);
            case PARAMETER -> {
                if (node.isLeaf()) {
                    operands.merge(node.text(), 1L, Long::sum);
                }
            }
            default -> {}
        }
        if (classifier.isStatement(node)) {
            statements++;
        }
    }

    /** Opening brackets stand for the whole bracket pair. */
    static String operatorKey(String kind) {
        return switch (kind) {
            case "(" -> "()";
            case "[" -> "[]";
            case "{" -> "{}";
            default -> kind;
        };
    }

    long count(SemanticCategory category) {
        return categories.getOrDefault(category, 0L);
    }

    long count(SemanticCategory... categoryList) {
        long total = 0;
        for (var c : categoryList) {
            total += count(c);
        }
        return total;
    }

    SortedMap<String, Long> operators() {
        return operators;
    }

    SortedMap<String, Long> operands() {
        return operands;
    }

    long statements() {
        return statements;
    }
}
