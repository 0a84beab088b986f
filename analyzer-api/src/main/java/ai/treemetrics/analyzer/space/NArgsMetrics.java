package ai.treemetrics.analyzer.space;

/**
 * @param nargs parameters of this function or closure, 0 for other spaces
 * @param total sum over the function spaces of the subtree, this one included
 */
public record NArgsMetrics(long nargs, long total, long min, long max, double average) {}
