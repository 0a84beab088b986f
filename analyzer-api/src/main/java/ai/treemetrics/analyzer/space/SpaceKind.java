package ai.treemetrics.analyzer.space;

import java.util.Locale;

public enum SpaceKind {
    UNIT,
    NAMESPACE,
    TYPE,
    FUNCTION,
    CLOSURE;

    public boolean isFunctionLike() {
        return this == FUNCTION || this == CLOSURE;
    }

    /** Lower-case label used in reports. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
