package ai.treemetrics.analyzer.space;

public record LocMetrics(long physical, long sloc, long ploc, long lloc, long cloc, long blank) {}
