package ai.treemetrics.analyzer.space;

/**
 * @param cognitive value of the space itself
 * @param sum sum over the space and all its descendants
 */
public record CognitiveMetrics(double cognitive, double sum, double average, double min, double max) {}
