package ai.treemetrics.space;

import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.analyzer.space.SpaceKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A space as discovered by {@link SpaceTreeBuilder}, before metrics are attached. The unit scope's range is the whole
 * file; every other scope covers exactly its boundary node.
 */
public final class SpaceScope {
    private final SpaceKind kind;
    private final String name;
    private final SyntaxNode node;
    private final int startByte;
    private final int endByte;
    private final List<SpaceScope> children = new ArrayList<>();

    SpaceScope(SpaceKind kind, String name, SyntaxNode node, int startByte, int endByte) {
        this.kind = kind;
        this.name = name;
        this.node = node;
        this.startByte = startByte;
        this.endByte = endByte;
    }

    public SpaceKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    /** The boundary node, or the tree root for the unit. */
    public SyntaxNode node() {
        return node;
    }

    public int startByte() {
        return startByte;
    }

    public int endByte() {
        return endByte;
    }

    public List<SpaceScope> children() {
        return Collections.unmodifiableList(children);
    }

    void addChild(SpaceScope child) {
        children.add(child);
    }

    @Override
    public String toString() {
        return kind.label() + " " + name + " [" + startByte + ", " + endByte + ")";
    }
}
