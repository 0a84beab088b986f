package ai.treemetrics.analyzer.space;

/**
 * @param cyclomatic value of the space itself
 * @param sum sum over the space and all its descendants
 */
public record CyclomaticMetrics(double cyclomatic, double sum, double average, double min, double max) {}
