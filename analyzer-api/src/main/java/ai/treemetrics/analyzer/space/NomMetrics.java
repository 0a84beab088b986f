package ai.treemetrics.analyzer.space;

/**
 * @param methods NOM: direct named methods of a type space, 0 elsewhere
 * @param publicMethods NPM: the public subset of {@code methods}
 * @param functions named functions in the subtree, this space included
 * @param closures closures in the subtree, this space included
 */
public record NomMetrics(long methods, long publicMethods, long functions, long closures) {}
