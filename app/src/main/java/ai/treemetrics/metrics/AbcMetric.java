package ai.treemetrics.metrics;

import static ai.treemetrics.analyzer.SemanticCategory.*;

import ai.treemetrics.analyzer.space.AbcMetrics;

/** Assignments, branches (calls) and conditions of a space's own code. */
final class AbcMetric {
    private AbcMetric() {}

    static AbcMetrics compute(OwnCodeCounts counts) {
        long a = counts.count(ASSIGNMENT);
        long b = counts.count(CALL);
        long c = counts.count(BRANCH, ALTERNATIVE, ELSE, CASE, LOGICAL_AND_OR);
        return new AbcMetrics(a, b, c, Math.sqrt((double) a * a + (double) b * b + (double) c * c));
    }
}
