package ai.treemetrics.analyzer.space;

public record ExitMetrics(double exits, double sum, double average, double min, double max) {}
