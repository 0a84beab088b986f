package ai.treemetrics.cli;

import ai.treemetrics.output.OutputFormat;
import ai.treemetrics.util.GlobFilter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settings of a batch run: command line values layered over {@code treemetrics.properties}, layered over built-in
 * defaults.
 *
 * @param format null when neither the command line nor the file chose one
 */
public record RunConfig(
        int jobs,
        long timeoutSeconds,
        @Nullable OutputFormat format,
        boolean pretty,
        List<String> include,
        List<String> exclude) {
    private static final Logger logger = LogManager.getLogger(RunConfig.class);

    public static final String DEFAULT_FILE_NAME = "treemetrics.properties";

    public static final String KEY_JOBS = "jobs";
    public static final String KEY_TIMEOUT = "timeout.seconds";
    public static final String KEY_FORMAT = "output.format";
    public static final String KEY_PRETTY = "output.pretty";
    public static final String KEY_INCLUDE = "include";
    public static final String KEY_EXCLUDE = "exclude";

    public RunConfig {
        include = List.copyOf(include);
        exclude = List.copyOf(exclude);
    }

    public OutputFormat formatOrDefault() {
        return format == null ? OutputFormat.JSON : format;
    }

    public GlobFilter filter() {
        return new GlobFilter(include, exclude);
    }

    /**
     * Reads {@code configFile}, or {@code treemetrics.properties} in the working directory when it exists.
     *
     * @throws IllegalArgumentException if an explicit file is missing or a value does not parse
     */
    public static Properties loadProperties(@Nullable Path configFile) {
        var props = new Properties();
        var path = configFile != null ? configFile : Path.of(DEFAULT_FILE_NAME);
        if (!Files.exists(path)) {
            if (configFile != null) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            return props;
        }
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
            logger.debug("Loaded {} settings from {}", props.size(), path);
        } catch (IOException e) {
            logger.error("Failed to load settings from {}: {}", path, e.getMessage());
        }
        return props;
    }

    public static RunConfig resolve(AnalysisOptions options, Properties props) {
        int jobs = options.jobs != null
                ? options.jobs
                : parseInt(props, KEY_JOBS, Runtime.getRuntime().availableProcessors());
        long timeout = options.timeoutSeconds != null ? options.timeoutSeconds : parseInt(props, KEY_TIMEOUT, 0);
        if (jobs < 1) {
            throw new IllegalArgumentException("jobs must be at least 1, got " + jobs);
        }
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout must not be negative, got " + timeout);
        }

        OutputFormat format = options.format;
        if (format == null && props.getProperty(KEY_FORMAT) != null) {
            var value = props.getProperty(KEY_FORMAT);
            format = OutputFormat.parse(value)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown output format: " + value));
        }
        boolean pretty = options.pretty || Boolean.parseBoolean(props.getProperty(KEY_PRETTY, "false"));
        var include = options.include.isEmpty() ? splitList(props.getProperty(KEY_INCLUDE)) : options.include;
        var exclude = options.exclude.isEmpty() ? splitList(props.getProperty(KEY_EXCLUDE)) : options.exclude;
        return new RunConfig(jobs, timeout, format, pretty, include, exclude);
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
        }
    }

    static List<String> splitList(@Nullable String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
