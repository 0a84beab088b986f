package ai.treemetrics.cli;

import static org.junit.jupiter.api.Assertions.*;

import ai.treemetrics.git.TestRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class TreeMetricsCliTest {
    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private CommandLine cli;
    private Path source;

    @BeforeEach
    void setUp() throws Exception {
        cli = new CommandLine(new TreeMetricsCli());
        var out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
        for (var name : new String[] {"metrics", "ops", "functions"}) {
            ((AbstractAnalysisCommand) cli.getSubcommands().get(name).getCommand()).setOut(out);
        }
        ((DiffCommand) cli.getSubcommands().get("diff").getCommand()).redirect(Map.of(), out);

        source = Files.writeString(
                tempDir.resolve("calc.py"),
                """
                def add(a, b):
                    return a + b

                def pick(flag):
                    return (lambda: 1) if flag else None
                """);
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Test
    void metricsPrintsJsonPerFile() throws Exception {
        int exit = cli.execute("metrics", source.toString());

        assertEquals(CommandLine.ExitCode.OK, exit);
        var tree = new ObjectMapper().readTree(output());
        assertEquals(source.toString(), tree.get("name").asText());
        assertEquals(2, tree.get("spaces").size());
        assertEquals(2, tree.get("metrics").get("nom").get("functions").asInt());
    }

    @Test
    void functionsPrintsSpansAsText() {
        int exit = cli.execute("functions", source.toString());

        assertEquals(CommandLine.ExitCode.OK, exit);
        assertEquals(source + "\nadd: 1-2\npick: 4-5\n<anonymous>: 5-5\n", output());
    }

    @Test
    void opsListsOperatorsAsYaml() {
        int exit = cli.execute("ops", "-O", "yaml", source.toString());

        assertEquals(CommandLine.ExitCode.OK, exit);
        assertTrue(output().contains("operators:"), output());
    }

    @Test
    void outputDirectoryMirrorsInputs() throws Exception {
        var dir = Files.createDirectories(tempDir.resolve("src/pkg"));
        Files.writeString(dir.resolve("main.go"), "package pkg\n\nfunc Main() {}\n");
        var outDir = tempDir.resolve("out");

        int exit = cli.execute("metrics", "-O", "toml", "-o", outDir.toString(), tempDir.resolve("src").toString());

        assertEquals(CommandLine.ExitCode.OK, exit);
        assertTrue(Files.isRegularFile(outDir.resolve("pkg/main.go.toml")));
        assertEquals("", output());
    }

    @Test
    void unsupportedFilesFailTheRun() throws Exception {
        var notes = Files.writeString(tempDir.resolve("notes.txt"), "plain text");

        int exit = cli.execute("metrics", source.toString(), notes.toString());

        assertEquals(CommandLine.ExitCode.SOFTWARE, exit);
        assertTrue(output().contains("\"name\":\"" + source + "\""), output());
    }

    @Test
    void forcedLanguageAnalyzesAnyExtension() throws Exception {
        var script = Files.writeString(tempDir.resolve("script"), "def run():\n    pass\n");

        int exit = cli.execute("functions", "-l", "python", script.toString());

        assertEquals(CommandLine.ExitCode.OK, exit);
        assertTrue(output().contains("run: 1-2"), output());
    }

    @Test
    void usageErrors() {
        assertEquals(CommandLine.ExitCode.USAGE, cli.execute());
        assertEquals(CommandLine.ExitCode.USAGE, cli.execute("metrics"));
        assertEquals(CommandLine.ExitCode.USAGE, cli.execute("metrics", tempDir.resolve("absent.py").toString()));
        assertEquals(CommandLine.ExitCode.USAGE, cli.execute("metrics", "-l", "cobol", source.toString()));
        assertEquals(CommandLine.ExitCode.USAGE, cli.execute("metrics", "-O", "xml", source.toString()));
    }

    @Test
    void emptyDirectoryIsNotAnError() throws Exception {
        var empty = Files.createDirectories(tempDir.resolve("empty"));

        assertEquals(CommandLine.ExitCode.OK, cli.execute("metrics", empty.toString()));
        assertEquals("", output());
    }

    @Test
    void diffReportsBetweenRevisions() throws Exception {
        String base;
        String head;
        try (var repo = TestRepository.init(tempDir.resolve("repo"))) {
            base = repo.write("m.py", "def a():\n    pass\n").commit("one");
            head = repo.write("m.py", "def a():\n    pass\n\ndef b():\n    pass\n").commit("two");
        }

        var repoDir = tempDir.resolve("repo").toString();
        int exit = cli.execute("diff", "--repo", repoDir, "--from", base, "--to", head, "-M", "nom.functions");

        assertEquals(CommandLine.ExitCode.OK, exit);
        var lines = output().split("\n");
        assertEquals("## Metrics Summary (`" + base + "`..`" + head + "`)", lines[0]);
        assertEquals("| File | Functions |", lines[2]);
        assertTrue(lines[4].startsWith("| m.py | 2 ("), lines[4]);
    }

    @Test
    void diffOutsideARepositoryFails() throws Exception {
        var plain = Files.createDirectories(tempDir.resolve("plain"));

        assertEquals(CommandLine.ExitCode.SOFTWARE, cli.execute("diff", "--repo", plain.toString()));
    }
}
