package ai.treemetrics.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Comparator;
import java.util.List;

public record FileDiff(
        String path,
        List<MetricDiff> metrics,
        @JsonProperty("is_new") boolean isNew,
        @JsonProperty("is_deleted") boolean isDeleted) {

    /** Most functions first, then by path. */
    public static final Comparator<FileDiff> REPORT_ORDER =
            Comparator.comparingLong(FileDiff::functionCount).reversed().thenComparing(FileDiff::path);

    public FileDiff {
        metrics = List.copyOf(metrics);
    }

    @JsonIgnore
    public boolean isAllUnchanged() {
        return metrics.stream().allMatch(m -> m.delta() == 0.0);
    }

    @JsonIgnore
    public long functionCount() {
        return metrics.stream()
                .filter(m -> m.name().equals("nom.functions"))
                .mapToLong(m -> (long) m.current())
                .findFirst()
                .orElse(0);
    }
}
