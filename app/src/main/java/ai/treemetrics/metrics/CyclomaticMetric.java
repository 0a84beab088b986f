package ai.treemetrics.metrics;

import static ai.treemetrics.analyzer.SemanticCategory.*;

import ai.treemetrics.analyzer.space.SpaceKind;

/**
 * McCabe complexity of one space: one independent path for functions, closures and the unit, plus one per decision
 * point in the space's own code. Types and namespaces report their own decision points only.
 */
final class CyclomaticMetric {
    private CyclomaticMetric() {}

    static double compute(SpaceKind kind, OwnCodeCounts counts) {
        long base =
                switch (kind) {
                    case UNIT, FUNCTION, CLOSURE -> 1;
                    case TYPE, NAMESPACE -> 0;
                };
        return base + counts.count(BRANCH, ALTERNATIVE, CASE, LOOP, LOGICAL_AND_OR);
    }
}
