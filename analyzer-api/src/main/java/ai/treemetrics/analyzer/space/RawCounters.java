package ai.treemetrics.analyzer.space;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/** Counters collected from a space's own code that the derived metrics are computed from. */
public record RawCounters(
        SortedMap<String, Long> operators,
        SortedMap<String, Long> operands,
        long branches,
        long loops,
        long logicalOperators,
        long exits,
        List<Long> parameterCounts,
        long publicAttributes,
        long methods) {

    public RawCounters {
        operators = Collections.unmodifiableSortedMap(new TreeMap<>(operators));
        operands = Collections.unmodifiableSortedMap(new TreeMap<>(operands));
        parameterCounts = List.copyOf(parameterCounts);
    }
}
