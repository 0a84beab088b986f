package ai.treemetrics.analyzer.space;

public record AbcMetrics(long assignments, long branches, long conditions, double magnitude) {}
