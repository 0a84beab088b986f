package ai.treemetrics.metrics;

import static ai.treemetrics.metrics.SafeMath.clamp;
import static ai.treemetrics.metrics.SafeMath.div;
import static ai.treemetrics.metrics.SafeMath.ln;
import static ai.treemetrics.metrics.SafeMath.log2;

import ai.treemetrics.analyzer.space.LocMetrics;
import ai.treemetrics.analyzer.space.MaintainabilityIndex;

/**
 * Maintainability index.
 *
 * <pre>
 * original      = 171 - 5.2 ln(V) - 0.23 G - 16.2 ln(SLOC)                                  in [0, 171]
 * sei           = 171 - 5.2 log2(V) - 0.23 G - 16.2 log2(SLOC) + 50 sin(sqrt(2.4 CLOC/SLOC)) in [0, 221]
 * visual studio = original * 100 / 171                                                     in [0, 100]
 * </pre>
 *
 * V is the Halstead volume and G the cyclomatic complexity of the space.
 */
final class MaintainabilityIndexMetric {
    static final double ORIGINAL_MAX = 171.0;
    static final double SEI_MAX = 221.0;

    private MaintainabilityIndexMetric() {}

    static MaintainabilityIndex compute(double volume, double cyclomatic, LocMetrics loc) {
        double sloc = loc.sloc();
        double original = 171.0 - 5.2 * ln(volume) - 0.23 * cyclomatic - 16.2 * ln(sloc);
        double commentRatio = div(loc.cloc(), sloc);
        double sei = 171.0
                - 5.2 * log2(volume)
                - 0.23 * cyclomatic
                - 16.2 * log2(sloc)
                + 50.0 * Math.sin(Math.sqrt(2.4 * commentRatio));

        double clampedOriginal = clamp(original, 0.0, ORIGINAL_MAX);
        return new MaintainabilityIndex(
                clampedOriginal, clamp(sei, 0.0, SEI_MAX), clampedOriginal * 100.0 / ORIGINAL_MAX);
    }
}
