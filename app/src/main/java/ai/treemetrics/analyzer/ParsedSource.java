package ai.treemetrics.analyzer;

/**
 * A parsed file: the source, its language and the root of its syntax tree.
 *
 * @param degraded the tree contains error or missing nodes, or was read with a grammar that cannot represent the source
 */
public record ParsedSource(Language language, SourceContent content, SyntaxNode root, boolean degraded) {}
