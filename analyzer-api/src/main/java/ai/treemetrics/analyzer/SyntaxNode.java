package ai.treemetrics.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a concrete syntax tree produced by an external parser. Byte offsets are UTF-8 offsets
 * into the analyzed source; rows are 0-based.
 */
public interface SyntaxNode {

    /** Grammar type name, e.g. {@code if_statement} or {@code +}. */
    String kind();

    /** Grammar symbol id of {@link #kind()}; stable for one grammar version. */
    int kindId();

    /** False for anonymous tokens such as punctuation and keywords. */
    boolean isNamed();

    boolean isError();

    boolean isMissing();

    /** True if this node or any descendant is an error or missing node. */
    boolean hasError();

    int startByte();

    int endByte();

    int startRow();

    int endRow();

    int childCount();

    SyntaxNode child(int index);

    Optional<SyntaxNode> childByFieldName(String fieldName);

    Optional<SyntaxNode> parent();

    /** Source text covered by this node. */
    String text();

    default List<SyntaxNode> children() {
        int count = childCount();
        var result = new ArrayList<SyntaxNode>(count);
        for (int i = 0; i < count; i++) {
            result.add(child(i));
        }
        return result;
    }

    default boolean isLeaf() {
        return childCount() == 0;
    }

    /** Nodes are views and may be re-created; two views are the same node when kind and range agree. */
    default boolean sameNode(SyntaxNode other) {
        return kindId() == other.kindId() && startByte() == other.startByte() && endByte() == other.endByte();
    }

    /** True if {@code child} is the node stored under {@code fieldName} of this node. */
    default boolean isField(String fieldName, SyntaxNode child) {
        return childByFieldName(fieldName).map(child::sameNode).orElse(false);
    }
}
