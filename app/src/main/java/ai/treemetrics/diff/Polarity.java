package ai.treemetrics.diff;

public enum Polarity {
    LOWER_IS_BETTER,
    HIGHER_IS_BETTER
}
