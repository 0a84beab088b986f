package ai.treemetrics.analyzer;

public enum Visibility {
    PUBLIC,
    PRIVATE,
    UNKNOWN
}
