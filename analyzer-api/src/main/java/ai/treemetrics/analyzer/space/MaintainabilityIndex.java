package ai.treemetrics.analyzer.space;

/**
 * @param original 171 based index, clamped to [0, 171]
 * @param sei variant with the comment-density term, clamped to [0, 221]
 * @param visualStudio original rescaled to [0, 100]
 */
public record MaintainabilityIndex(double original, double sei, double visualStudio) {}
