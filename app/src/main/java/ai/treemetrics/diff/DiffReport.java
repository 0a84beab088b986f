package ai.treemetrics.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import java.util.List;
import java.util.Locale;

/** Renders file diffs as a Markdown table for pull request comments, or as JSON. */
public final class DiffReport {
    static final String NEW = "\uD83C\uDD95"; // 🆕
    static final String UNCHANGED = "\u26AA"; // ⚪
    static final String WORSE = "\uD83D\uDD34"; // 🔴
    static final String BETTER = "\uD83D\uDFE2"; // 🟢

    private static final ObjectMapper JSON_MAPPER =
            new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private DiffReport() {}

    public static String markdown(
            List<FileDiff> diffs, List<MetricSelector> selectors, String fromLabel, String from, String to) {
        var out = new StringBuilder();
        out.append("## Metrics Summary (`").append(from).append("`..`").append(to).append("`)\n\n");
        if (diffs.isEmpty()) {
            out.append("No metric changes detected.\n");
            return out.toString();
        }

        out.append("| File |");
        selectors.forEach(sel -> out.append(' ').append(sel.label()).append(" |"));
        out.append('\n');
        out.append("|---|");
        selectors.forEach(sel -> out.append("---:|"));
        out.append('\n');

        for (var diff : diffs) {
            out.append("| ").append(diff.path()).append(" |");
            for (var metric : diff.metrics()) {
                out.append(' ').append(formatCell(metric, fromLabel)).append(" |");
            }
            out.append('\n');
        }
        return out.toString();
    }

    public static String json(List<FileDiff> diffs) throws JsonProcessingException {
        return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(diffs) + "\n";
    }

    static String formatCell(MetricDiff metric, String fromLabel) {
        var current = formatNumber(metric.current());
        if (metric.isNew()) {
            return current + " " + NEW;
        }
        if (metric.isDeleted()) {
            return "0 (was: " + formatNumber(metric.baseline()) + ") " + trendEmoji(metric.delta(), metric.polarity());
        }
        if (metric.delta() == 0.0) {
            return current + " " + UNCHANGED;
        }
        return current + " (" + fromLabel + ": " + formatNumber(metric.baseline()) + ") "
                + trendEmoji(metric.delta(), metric.polarity());
    }

    static String trendEmoji(double delta, Polarity polarity) {
        if (delta == 0.0) {
            return UNCHANGED;
        }
        boolean increased = delta > 0;
        return switch (polarity) {
            case LOWER_IS_BETTER -> increased ? WORSE : BETTER;
            case HIGHER_IS_BETTER -> increased ? BETTER : WORSE;
        };
    }

    /** Integral values without a fraction, everything else with two decimals. */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
