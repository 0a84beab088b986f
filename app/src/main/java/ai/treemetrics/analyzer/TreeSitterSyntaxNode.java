package ai.treemetrics.analyzer;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/** {@link SyntaxNode} backed by a tree-sitter node. Holds the tree so its native memory outlives every view. */
public final class TreeSitterSyntaxNode implements SyntaxNode {
    private static final String ERROR_TYPE = "ERROR";

    private final TSNode node;
    private final TSTree tree;
    private final SourceContent content;

    TreeSitterSyntaxNode(TSNode node, TSTree tree, SourceContent content) {
        this.node = node;
        this.tree = tree;
        this.content = content;
    }

    private @Nullable TreeSitterSyntaxNode wrap(@Nullable TSNode other) {
        if (other == null || other.isNull()) {
            return null;
        }
        return new TreeSitterSyntaxNode(other, tree, content);
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public int kindId() {
        return node.getSymbol();
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    public boolean isError() {
        return ERROR_TYPE.equals(node.getType());
    }

    @Override
    public boolean isMissing() {
        return node.isMissing();
    }

    @Override
    public boolean hasError() {
        return node.hasError();
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public int startRow() {
        return node.getStartPoint().getRow();
    }

    @Override
    public int endRow() {
        return node.getEndPoint().getRow();
    }

    @Override
    public int childCount() {
        return node.getChildCount();
    }

    @Override
    public SyntaxNode child(int index) {
        var c = wrap(node.getChild(index));
        if (c == null) {
            throw new IndexOutOfBoundsException("No child " + index + " under " + node.getType());
        }
        return c;
    }

    @Override
    public Optional<SyntaxNode> childByFieldName(String fieldName) {
        return Optional.ofNullable(wrap(node.getChildByFieldName(fieldName)));
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(wrap(node.getParent()));
    }

    @Override
    public String text() {
        return content.substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    @Override
    public String toString() {
        return kind() + "[" + startByte() + ", " + endByte() + ")";
    }
}
