package ai.treemetrics.diff;

import static org.junit.jupiter.api.Assertions.*;

import ai.treemetrics.git.GitRevisions;
import ai.treemetrics.git.RevisionRange;
import ai.treemetrics.git.TestRepository;
import ai.treemetrics.util.GlobFilter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetricsDifferTest {
    @TempDir
    Path tempDir;

    private TestRepository repo;
    private GitRevisions git;
    private String baseline;
    private String current;

    @BeforeEach
    void setUp() throws Exception {
        repo = TestRepository.init(tempDir.resolve("repo"));
        baseline = repo.write("app.py", "def f(x):\n    return x\n")
                .write("old.rs", "fn z() {}\n")
                .write("stable.py", "def s():\n    pass\n")
                .write("README.md", "v1\n")
                .commit("baseline");
        current = repo.write(
                        "app.py",
                        """
                        def f(x):
                            if x:
                                return x
                            return 0


                        def g():
                            pass
                        """)
                .delete("old.rs")
                .write("svc/new.go", "package svc\n\nfunc N() int {\n\treturn 1\n}\n")
                .write("stable.py", "# only a comment changed\ndef s():\n    pass\n")
                .write("README.md", "v2\n")
                .commit("current");
        git = GitRevisions.open(repo.root());
    }

    @AfterEach
    void tearDown() {
        git.close();
        repo.close();
    }

    private List<FileDiff> diff(GlobFilter filter, boolean showUnchanged) throws Exception {
        var differ = new MetricsDiffer(git, filter, MetricSelector.parse(List.of()));
        return differ.diff(new RevisionRange(baseline, current, null), showUnchanged);
    }

    private static MetricDiff metric(FileDiff file, String name) {
        return file.metrics().stream()
                .filter(m -> m.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void reportsChangedSourceFilesInReportOrder() throws Exception {
        var diffs = diff(GlobFilter.acceptAll(), false);

        assertEquals(List.of("app.py", "svc/new.go", "old.rs"), diffs.stream().map(FileDiff::path).toList());

        var app = diffs.get(0);
        assertFalse(app.isNew());
        assertFalse(app.isDeleted());
        assertEquals(2.0, metric(app, "nom.functions").current());
        assertEquals(1.0, metric(app, "nom.functions").baseline());
        assertEquals(1.0, metric(app, "nom.functions").delta());
        assertEquals(2.0, metric(app, "cyclomatic").delta());

        var added = diffs.get(1);
        assertTrue(added.isNew());
        assertEquals(0.0, metric(added, "cyclomatic").baseline());
        assertTrue(metric(added, "cyclomatic").isNew());

        var removed = diffs.get(2);
        assertTrue(removed.isDeleted());
        assertEquals(0.0, metric(removed, "nom.functions").current());
        assertEquals(1.0, metric(removed, "nom.functions").baseline());
    }

    @Test
    void unchangedFilesAppearOnlyOnRequest() throws Exception {
        assertTrue(diff(GlobFilter.acceptAll(), false).stream().noneMatch(d -> d.path().equals("stable.py")));

        var withUnchanged = diff(GlobFilter.acceptAll(), true);
        var stable = withUnchanged.stream()
                .filter(d -> d.path().equals("stable.py"))
                .findFirst()
                .orElseThrow();
        assertTrue(stable.isAllUnchanged());
        assertTrue(withUnchanged.stream().noneMatch(d -> d.path().equals("README.md")));
    }

    @Test
    void globsNarrowTheReport() throws Exception {
        var diffs = diff(new GlobFilter(List.of(), List.of("**/*.go", "*.rs")), false);

        assertEquals(List.of("app.py"), diffs.stream().map(FileDiff::path).toList());
    }

    @Test
    void ciFileListReplacesTheTreeDiff() throws Exception {
        var differ = new MetricsDiffer(git, GlobFilter.acceptAll(), MetricSelector.parse(List.of("nom.functions")));

        var diffs = differ.diff(new RevisionRange(baseline, current, List.of("svc/new.go")), false);

        assertEquals(1, diffs.size());
        var newGo = diffs.get(0);
        assertEquals("svc/new.go", newGo.path());
        // listed files are compared as modifications, so a missing baseline is not flagged as new
        assertFalse(newGo.isNew());
        assertEquals(1.0, metric(newGo, "nom.functions").delta());
    }

    @Test
    void markdownReportForTheRange() throws Exception {
        var selectors = MetricSelector.parse(List.of());
        var diffs = diff(GlobFilter.acceptAll(), false);

        var md = DiffReport.markdown(diffs, selectors, "main", baseline, current);

        assertTrue(md.startsWith("## Metrics Summary (`" + baseline + "`..`" + current + "`)\n\n"));
        assertTrue(md.contains("| app.py | 4 (main: 2) " + DiffReport.WORSE + " |"), md);
        assertTrue(md.contains("| svc/new.go | 2 " + DiffReport.NEW + " |"), md);
    }
}
