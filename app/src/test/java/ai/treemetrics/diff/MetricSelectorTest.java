package ai.treemetrics.diff;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricSelectorTest {

    @Test
    void emptySelectionUsesDefaults() {
        var names = MetricSelector.parse(List.of()).stream().map(MetricSelector::name).toList();

        assertEquals(MetricSelector.DEFAULTS, names);
        assertEquals(MetricSelector.DEFAULTS, MetricSelector.parse(List.of(" ", ""))
                .stream()
                .map(MetricSelector::name)
                .toList());
    }

    @Test
    void selectionKeepsOrder() {
        var selectors = MetricSelector.parse(List.of("mi", "halstead.volume", "cyclomatic"));

        assertEquals(
                List.of("mi", "halstead.volume", "cyclomatic"),
                selectors.stream().map(MetricSelector::name).toList());
        assertEquals("Halstead Vol", selectors.get(1).label());
        assertEquals(Polarity.HIGHER_IS_BETTER, selectors.get(0).polarity());
    }

    @Test
    void signPrefixOverridesPolarity() {
        var selectors = MetricSelector.parse(List.of("+cyclomatic", "-mi"));

        assertEquals("cyclomatic", selectors.get(0).name());
        assertEquals(Polarity.HIGHER_IS_BETTER, selectors.get(0).polarity());
        assertEquals("mi", selectors.get(1).name());
        assertEquals(Polarity.LOWER_IS_BETTER, selectors.get(1).polarity());
    }

    @Test
    void unknownNamesAreSkipped() {
        var selectors = MetricSelector.parse(List.of("bogus", "loc.lloc"));

        assertEquals(1, selectors.size());
        assertEquals("loc.lloc", selectors.get(0).name());
    }

    @Test
    void reportOrderPutsLargerFilesFirst() {
        var few = fileWithFunctions("b.py", 1);
        var many = fileWithFunctions("z.py", 5);
        var tie = fileWithFunctions("a.py", 1);

        var sorted = new ArrayList<>(List.of(few, many, tie));
        sorted.sort(FileDiff.REPORT_ORDER);

        assertEquals(List.of("z.py", "a.py", "b.py"), sorted.stream().map(FileDiff::path).toList());
    }

    private static FileDiff fileWithFunctions(String path, int functions) {
        var metric = new MetricDiff(
                "nom.functions", "Functions", functions, 0, functions, Polarity.LOWER_IS_BETTER, true, false);
        return new FileDiff(path, List.of(metric), true, false);
    }
}
