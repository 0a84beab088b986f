package ai.treemetrics.metrics;

import static ai.treemetrics.metrics.SafeMath.div;
import static ai.treemetrics.metrics.SafeMath.log2;

import ai.treemetrics.analyzer.space.HalsteadMetrics;
import java.util.Map;

/** Halstead software science measures from operator and operand multisets. */
final class HalsteadMetric {
    /** Stroud number used for the time estimate, in elementary mental discriminations per second. */
    private static final double STROUD = 18.0;

    private static final double BUGS_DIVISOR = 3000.0;

    private HalsteadMetric() {}

    static HalsteadMetrics compute(Map<String, Long> operators, Map<String, Long> operands) {
        long n1 = operators.size();
        long n2 = operands.size();
        long bigN1 = operators.values().stream().mapToLong(Long::longValue).sum();
        long bigN2 = operands.values().stream().mapToLong(Long::longValue).sum();
        return fromCounts(n1, bigN1, n2, bigN2);
    }

    /**
     * @param n1 distinct operators
     * @param bigN1 total operators
     * @param n2 distinct operands
     * @param bigN2 total operands
     */
    static HalsteadMetrics fromCounts(long n1, long bigN1, long n2, long bigN2) {
        long vocabulary = n1 + n2;
        long length = bigN1 + bigN2;
        double estimatedLength = n1 * log2(n1) + n2 * log2(n2);
        double purityRatio = div(estimatedLength, length);
        double volume = length * log2(vocabulary);
        double difficulty = div(n1, 2.0) * div(bigN2, n2);
        double level = div(1.0, difficulty);
        double effort = difficulty * volume;
        double time = effort / STROUD;
        double bugs = volume / BUGS_DIVISOR;
        return new HalsteadMetrics(
                n1,
                bigN1,
                n2,
                bigN2,
                vocabulary,
                length,
                estimatedLength,
                purityRatio,
                volume,
                difficulty,
                level,
                effort,
                time,
                bugs);
    }
}
