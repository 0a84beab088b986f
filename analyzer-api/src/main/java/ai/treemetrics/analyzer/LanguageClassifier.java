package ai.treemetrics.analyzer;

/**
 * Maps the raw node kinds of one language onto {@link SemanticCategory}. Implementations are stateless and safe to
 * share between threads.
 */
public interface LanguageClassifier {

    Language language();

    /** Total over every node of the language; unknown kinds are {@link SemanticCategory#OTHER}. */
    SemanticCategory classify(SyntaxNode node);

    boolean isComment(SyntaxNode node);

    /** True for the node kinds that count as one logical line (LLOC). */
    boolean isStatement(SyntaxNode node);

    /** Visibility of a declaration node (function, method, field, type); {@link Visibility#UNKNOWN} otherwise. */
    Visibility visibility(SyntaxNode node);

    /** Best-effort display name of a space boundary node. */
    String spaceName(SyntaxNode node);
}
