package ai.treemetrics.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record MetricDiff(
        String name,
        String label,
        double current,
        double baseline,
        double delta,
        @JsonIgnore Polarity polarity,
        @JsonProperty("is_new") boolean isNew,
        @JsonProperty("is_deleted") boolean isDeleted) {}
