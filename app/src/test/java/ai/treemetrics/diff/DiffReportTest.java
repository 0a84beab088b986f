package ai.treemetrics.diff;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class DiffReportTest {

    private static MetricDiff metric(String name, double current, double baseline, boolean isNew, boolean isDeleted) {
        var selector = MetricSelector.parse(List.of(name)).get(0);
        return new MetricDiff(
                name, selector.label(), current, baseline, current - baseline, selector.polarity(), isNew, isDeleted);
    }

    @Test
    void numbersDropTheFractionOnlyWhenIntegral() {
        assertEquals("12", DiffReport.formatNumber(12.0));
        assertEquals("0", DiffReport.formatNumber(0.0));
        assertEquals("-3", DiffReport.formatNumber(-3.0));
        assertEquals("3.14", DiffReport.formatNumber(3.14159));
        assertEquals("0.50", DiffReport.formatNumber(0.5));
    }

    @Test
    void trendDependsOnPolarity() {
        assertEquals(DiffReport.WORSE, DiffReport.trendEmoji(2, Polarity.LOWER_IS_BETTER));
        assertEquals(DiffReport.BETTER, DiffReport.trendEmoji(-2, Polarity.LOWER_IS_BETTER));
        assertEquals(DiffReport.BETTER, DiffReport.trendEmoji(2, Polarity.HIGHER_IS_BETTER));
        assertEquals(DiffReport.WORSE, DiffReport.trendEmoji(-2, Polarity.HIGHER_IS_BETTER));
        assertEquals(DiffReport.UNCHANGED, DiffReport.trendEmoji(0, Polarity.HIGHER_IS_BETTER));
    }

    @Test
    void cells() {
        assertEquals("7 " + DiffReport.NEW, DiffReport.formatCell(metric("cyclomatic", 7, 0, true, false), "main"));
        assertEquals(
                "0 (was: 4) " + DiffReport.BETTER,
                DiffReport.formatCell(metric("cyclomatic", 0, 4, false, true), "main"));
        assertEquals(
                "5 " + DiffReport.UNCHANGED, DiffReport.formatCell(metric("cognitive", 5, 5, false, false), "main"));
        assertEquals(
                "9 (main: 6) " + DiffReport.WORSE,
                DiffReport.formatCell(metric("cyclomatic", 9, 6, false, false), "main"));
        assertEquals(
                "80.25 (main: 90) " + DiffReport.WORSE,
                DiffReport.formatCell(metric("mi", 80.25, 90, false, false), "main"));
    }

    @Test
    void markdownTable() {
        var selectors = MetricSelector.parse(List.of("cyclomatic", "nom.functions"));
        var diffs = List.of(new FileDiff(
                "src/app.py",
                List.of(metric("cyclomatic", 5, 3, false, false), metric("nom.functions", 2, 2, false, false)),
                false,
                false));

        var md = DiffReport.markdown(diffs, selectors, "main", "abc123", "def456");

        var lines = md.split("\n");
        assertEquals("## Metrics Summary (`abc123`..`def456`)", lines[0]);
        assertEquals("", lines[1]);
        assertEquals("| File | Cyclomatic | Functions |", lines[2]);
        assertEquals("|---|---:|---:|", lines[3]);
        assertEquals(
                "| src/app.py | 5 (main: 3) " + DiffReport.WORSE + " | 2 " + DiffReport.UNCHANGED + " |", lines[4]);
        assertEquals(5, lines.length);
    }

    @Test
    void emptyMarkdownReport() {
        var md = DiffReport.markdown(List.of(), MetricSelector.parse(List.of()), "main", "main", "HEAD");

        assertEquals("## Metrics Summary (`main`..`HEAD`)\n\nNo metric changes detected.\n", md);
    }

    @Test
    void jsonUsesSnakeCaseAndHidesPolarity() throws Exception {
        var diffs = List.of(new FileDiff("a.go", List.of(metric("cyclomatic", 2, 0, true, false)), true, false));

        var json = DiffReport.json(diffs);

        assertTrue(json.contains("\"is_new\" : true"), json);
        assertTrue(json.contains("\"is_deleted\" : false"), json);
        assertTrue(json.contains("\"delta\" : 2.0"), json);
        assertFalse(json.contains("polarity"), json);
        assertTrue(json.endsWith("]\n"));
    }
}
