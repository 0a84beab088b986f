package ai.treemetrics.metrics;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.Visibility;
import ai.treemetrics.analyzer.space.SpaceKind;
import ai.treemetrics.space.SpaceScope;

/** NOM, NPM and NPA of a type space. WMC needs the methods' cyclomatic values and is summed by the engine. */
final class TypeMetrics {
    private TypeMetrics() {}

    static long methods(SpaceScope type) {
        return type.children().stream().filter(c -> c.kind() == SpaceKind.FUNCTION).count();
    }

    static long publicMethods(SpaceScope type, LanguageClassifier classifier) {
        return type.children().stream()
                .filter(c -> c.kind() == SpaceKind.FUNCTION)
                .filter(c -> classifier.visibility(c.node()) == Visibility.PUBLIC)
                .count();
    }

    /** Public attribute declarations of the type itself, not of nested types. */
    static long publicAttributes(SpaceScope type, LanguageClassifier classifier) {
        long[] count = {0};
        OwnCode.walk(type.node(), classifier, true, (node, category) -> {
            if (category == SemanticCategory.ATTRIBUTE_DECLARATION
                    && classifier.visibility(node) == Visibility.PUBLIC) {
                count[0]++;
            }
        });
        return count[0];
    }
}
