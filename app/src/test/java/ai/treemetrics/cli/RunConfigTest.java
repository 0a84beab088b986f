package ai.treemetrics.cli;

import static org.junit.jupiter.api.Assertions.*;

import ai.treemetrics.output.OutputFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunConfigTest {
    @TempDir
    Path tempDir;

    private static Properties props(String... keyValues) {
        var props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    @Test
    void defaultsWithoutSettings() {
        var config = RunConfig.resolve(new AnalysisOptions(), new Properties());

        assertEquals(Runtime.getRuntime().availableProcessors(), config.jobs());
        assertEquals(0, config.timeoutSeconds());
        assertNull(config.format());
        assertEquals(OutputFormat.JSON, config.formatOrDefault());
        assertFalse(config.pretty());
        assertTrue(config.include().isEmpty());
    }

    @Test
    void fileValuesApplyWhenTheCommandLineIsSilent() {
        var config = RunConfig.resolve(
                new AnalysisOptions(),
                props(
                        RunConfig.KEY_JOBS, "3",
                        RunConfig.KEY_TIMEOUT, "30",
                        RunConfig.KEY_FORMAT, "YAML",
                        RunConfig.KEY_PRETTY, "true",
                        RunConfig.KEY_INCLUDE, "src/**, lib/**",
                        RunConfig.KEY_EXCLUDE, "**/gen/**"));

        assertEquals(3, config.jobs());
        assertEquals(30, config.timeoutSeconds());
        assertEquals(OutputFormat.YAML, config.format());
        assertTrue(config.pretty());
        assertEquals(List.of("src/**", "lib/**"), config.include());
        assertEquals(List.of("**/gen/**"), config.exclude());
    }

    @Test
    void commandLineOverridesTheFile() {
        var options = new AnalysisOptions();
        options.jobs = 1;
        options.timeoutSeconds = 5L;
        options.format = OutputFormat.CBOR;
        options.include = List.of("*.go");

        var config = RunConfig.resolve(
                options,
                props(RunConfig.KEY_JOBS, "8", RunConfig.KEY_FORMAT, "toml", RunConfig.KEY_INCLUDE, "*.py"));

        assertEquals(1, config.jobs());
        assertEquals(5, config.timeoutSeconds());
        assertEquals(OutputFormat.CBOR, config.format());
        assertEquals(List.of("*.go"), config.include());
    }

    @Test
    void invalidValuesAreRejected() {
        var options = new AnalysisOptions();
        assertThrows(IllegalArgumentException.class, () -> RunConfig.resolve(options, props(RunConfig.KEY_JOBS, "x")));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.resolve(options, props(RunConfig.KEY_JOBS, "0")));
        assertThrows(
                IllegalArgumentException.class, () -> RunConfig.resolve(options, props(RunConfig.KEY_FORMAT, "xml")));
        assertThrows(
                IllegalArgumentException.class, () -> RunConfig.resolve(options, props(RunConfig.KEY_TIMEOUT, "-1")));
    }

    @Test
    void loadsAnExplicitFile() throws Exception {
        var file = Files.writeString(tempDir.resolve("custom.properties"), "jobs = 2\noutput.format = json\n");

        var props = RunConfig.loadProperties(file);

        assertEquals("2", props.getProperty(RunConfig.KEY_JOBS));
        assertEquals("json", props.getProperty(RunConfig.KEY_FORMAT));
    }

    @Test
    void missingExplicitFileIsAnError() {
        assertThrows(
                IllegalArgumentException.class, () -> RunConfig.loadProperties(tempDir.resolve("absent.properties")));
    }

    @Test
    void listsSplitOnCommas() {
        assertEquals(List.of("a", "b"), RunConfig.splitList(" a ,, b "));
        assertEquals(List.of(), RunConfig.splitList(null));
    }
}
