package ai.treemetrics.analyzer.space;

/** Halstead measures; n1/N1 are distinct/total operators and n2/N2 distinct/total operands. */
public record HalsteadMetrics(
        long uniqueOperators,
        long totalOperators,
        long uniqueOperands,
        long totalOperands,
        long vocabulary,
        long length,
        double estimatedProgramLength,
        double purityRatio,
        double volume,
        double difficulty,
        double level,
        double effort,
        double time,
        double bugs) {}
