package ai.treemetrics.analyzer;

/**
 * Language-independent role of a syntax node. Every node receives exactly one category; anything the metric
 * algorithms do not care about is {@link #OTHER}.
 */
public enum SemanticCategory {
    OPERATOR,
    OPERAND,
    /** if, ternary, catch/except: adds a decision point and opens a nesting level. */
    BRANCH,
    /** else-if / elif: adds a decision point without nesting. */
    ALTERNATIVE,
    /** A plain else branch. */
    ELSE,
    SWITCH,
    CASE,
    LOOP,
    LOGICAL_AND_OR,
    EXIT_STATEMENT,
    FUNCTION_BOUNDARY,
    CLOSURE_BOUNDARY,
    TYPE_BOUNDARY,
    NAMESPACE_BOUNDARY,
    PARAMETER,
    PUBLIC_ATTRIBUTE_MARKER,
    ATTRIBUTE_DECLARATION,
    ASSIGNMENT,
    CALL,
    COMMENT,
    STRING_LITERAL,
    OTHER;

    public boolean isSpaceBoundary() {
        return this == FUNCTION_BOUNDARY
                || this == CLOSURE_BOUNDARY
                || this == TYPE_BOUNDARY
                || this == NAMESPACE_BOUNDARY;
    }

    public boolean isFunctionLike() {
        return this == FUNCTION_BOUNDARY || this == CLOSURE_BOUNDARY;
    }
}
