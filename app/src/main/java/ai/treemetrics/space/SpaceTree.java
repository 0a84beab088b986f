package ai.treemetrics.space;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.ParsedSource;

/**
 * The space skeleton of one file.
 *
 * @param degraded the syntax tree contained error or missing nodes
 */
public record SpaceTree(ParsedSource source, LanguageClassifier classifier, SpaceScope unit, boolean degraded) {}
