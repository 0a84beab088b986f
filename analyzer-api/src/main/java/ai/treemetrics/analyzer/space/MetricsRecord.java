package ai.treemetrics.analyzer.space;

/**
 * All metrics of one space. Every field is always populated; absent quantities are zero.
 *
 * @param npa public attributes of a type space, 0 elsewhere
 * @param wmc sum of the cyclomatic complexity of a type's direct methods, 0 elsewhere
 */
public record MetricsRecord(
        CyclomaticMetrics cyclomatic,
        CognitiveMetrics cognitive,
        HalsteadMetrics halstead,
        LocMetrics loc,
        AbcMetrics abc,
        MaintainabilityIndex mi,
        NArgsMetrics nargs,
        NomMetrics nom,
        long npa,
        double wmc,
        ExitMetrics nexits,
        RawCounters raw) {}
