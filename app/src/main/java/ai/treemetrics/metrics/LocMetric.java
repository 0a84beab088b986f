package ai.treemetrics.metrics;

import ai.treemetrics.analyzer.SourceContent;
import ai.treemetrics.analyzer.space.LocMetrics;
import ai.treemetrics.analyzer.space.SpaceKind;
import ai.treemetrics.space.SpaceScope;

/**
 * Line counts over the lines a space spans. The unit spans the whole file, so its counts are file totals rather than
 * sums of its children.
 */
final class LocMetric {
    private LocMetric() {}

    static LocMetrics compute(SpaceScope scope, SourceContent content, LineClassification lines, long lloc) {
        if (content.lineCount() == 0) {
            return new LocMetrics(0, 0, 0, lloc, 0, 0);
        }
        int firstRow;
        int lastRow;
        if (scope.kind() == SpaceKind.UNIT) {
            firstRow = 0;
            lastRow = content.lineCount() - 1;
        } else {
            firstRow = content.rowOfByte(scope.startByte());
            lastRow = content.lastRowOfRange(scope.startByte(), scope.endByte());
        }

        long physical = lastRow - firstRow + 1;
        long sloc = 0;
        long cloc = 0;
        for (int row = firstRow; row <= lastRow; row++) {
            if (content.isBlankLine(row)) {
                continue;
            }
            sloc++;
            if (lines.isCommentOnly(row)) {
                cloc++;
            }
        }
        return new LocMetrics(physical, sloc, sloc - cloc, lloc, cloc, physical - sloc);
    }
}
