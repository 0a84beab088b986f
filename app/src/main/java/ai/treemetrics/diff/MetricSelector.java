package ai.treemetrics.diff;

import ai.treemetrics.analyzer.space.Space;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** A Unit-level metric a diff report compares, with its column label and which direction counts as an improvement. */
public record MetricSelector(String name, String label, Polarity polarity, ToDoubleFunction<Space> extractor) {
    private static final Logger logger = LogManager.getLogger(MetricSelector.class);

    public static final List<MetricSelector> KNOWN = List.of(
            new MetricSelector("cyclomatic", "Cyclomatic", Polarity.LOWER_IS_BETTER, s -> s.metrics()
                    .cyclomatic()
                    .sum()),
            new MetricSelector("cognitive", "Cognitive", Polarity.LOWER_IS_BETTER, s -> s.metrics()
                    .cognitive()
                    .sum()),
            new MetricSelector("nom.functions", "Functions", Polarity.LOWER_IS_BETTER, s -> s.metrics()
                    .nom()
                    .functions()),
            new MetricSelector("loc.lloc", "LLOC", Polarity.LOWER_IS_BETTER, s -> s.metrics()
                    .loc()
                    .lloc()),
            new MetricSelector("mi", "MI", Polarity.HIGHER_IS_BETTER, s -> s.metrics()
                    .mi()
                    .original()),
            new MetricSelector("halstead.volume", "Halstead Vol", Polarity.LOWER_IS_BETTER, s -> s.metrics()
                    .halstead()
                    .volume()));

    public static final List<String> DEFAULTS = List.of("cyclomatic", "cognitive", "nom.functions", "loc.lloc");

    public double extract(Space unit) {
        return extractor.applyAsDouble(unit);
    }

    public MetricSelector withPolarity(Polarity newPolarity) {
        return new MetricSelector(name, label, newPolarity, extractor);
    }

    /**
     * Parses selector names. {@code +name} forces higher-is-better, {@code -name} lower-is-better. Unknown names are
     * logged and skipped; an empty list selects {@link #DEFAULTS}.
     */
    public static List<MetricSelector> parse(List<String> entries) {
        var effective = entries.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        if (effective.isEmpty()) {
            effective = DEFAULTS;
        }
        var selectors = new ArrayList<MetricSelector>();
        for (var entry : effective) {
            Polarity override = null;
            var name = entry;
            if (entry.startsWith("+")) {
                override = Polarity.HIGHER_IS_BETTER;
                name = entry.substring(1);
            } else if (entry.startsWith("-")) {
                override = Polarity.LOWER_IS_BETTER;
                name = entry.substring(1);
            }
            var lookup = name;
            var known = KNOWN.stream().filter(s -> s.name.equals(lookup)).findFirst();
            if (known.isEmpty()) {
                logger.warn("Unknown metric '{}', skipping", name);
                continue;
            }
            selectors.add(override == null ? known.get() : known.get().withPolarity(override));
        }
        return List.copyOf(selectors);
    }
}
