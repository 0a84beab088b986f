package ai.treemetrics.diff;

public enum DiffFormat {
    MARKDOWN,
    JSON
}
