package ai.treemetrics.analyzer.space;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * One lexical scope of a file (unit, namespace, type, function or closure) with its metrics. Lines are 1-based and
 * inclusive; bytes are UTF-8 offsets, end exclusive. Children are ordered by position and never overlap.
 *
 * @param degraded only ever true on the unit space, when the parse tree contained error nodes
 */
public record Space(
        SpaceKind kind,
        String name,
        int startByte,
        int endByte,
        int startLine,
        int endLine,
        boolean degraded,
        MetricsRecord metrics,
        List<Space> spaces) {

    public Space {
        spaces = List.copyOf(spaces);
    }

    /** This space followed by all of its descendants, depth-first in source order. */
    public Stream<Space> flatten() {
        var out = new ArrayList<Space>();
        var stack = new ArrayList<Space>();
        stack.add(this);
        while (!stack.isEmpty()) {
            var current = stack.remove(stack.size() - 1);
            out.add(current);
            for (int i = current.spaces.size() - 1; i >= 0; i--) {
                stack.add(current.spaces.get(i));
            }
        }
        return out.stream();
    }
}
