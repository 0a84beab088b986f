package ai.treemetrics.metrics;

import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SourceContent;
import ai.treemetrics.analyzer.SyntaxNode;
import java.util.ArrayDeque;
import java.util.BitSet;

/** Which lines of a file carry code tokens and which are covered by comments. Computed once per file. */
final class LineClassification {
    private final BitSet codeRows;
    private final BitSet commentRows;

    private LineClassification(BitSet codeRows, BitSet commentRows) {
        this.codeRows = codeRows;
        this.commentRows = commentRows;
    }

    static LineClassification of(SyntaxNode root, LanguageClassifier classifier, SourceContent content) {
        var code = new BitSet();
        var comments = new BitSet();
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            int start = node.startByte();
            int end = node.endByte();
            if (node != root && classifier.isComment(node)) {
                comments.set(content.rowOfByte(start), content.lastRowOfRange(start, end) + 1);
                continue;
            }
            if (node.isLeaf()) {
                if (end > start && !node.isMissing()) {
                    code.set(content.rowOfByte(start), content.lastRowOfRange(start, end) + 1);
                }
                continue;
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(node.child(i));
            }
        }
        return new LineClassification(code, comments);
    }

    /** A comment covers the line and no code token starts or continues on it. */
    boolean isCommentOnly(int row) {
        return commentRows.get(row) && !codeRows.get(row);
    }
}
