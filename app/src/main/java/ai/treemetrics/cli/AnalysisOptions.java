package ai.treemetrics.cli;

import ai.treemetrics.output.OutputFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/** Options shared by the commands that analyze files from disk. Unset values fall back to {@link RunConfig}. */
public class AnalysisOptions {

    @CommandLine.Parameters(paramLabel = "PATH", arity = "1..*", description = "Files or directories to analyze.")
    List<Path> paths = new ArrayList<>();

    @CommandLine.Option(
            names = {"-l", "--language"},
            description = "Analyze every file as this language (python, go, rust, typescript, tsx).")
    @Nullable
    String language;

    @CommandLine.Option(
            names = {"-I", "--include"},
            split = ",",
            description = "Glob of files to include, relative to each input directory. Can be repeated.")
    List<String> include = new ArrayList<>();

    @CommandLine.Option(
            names = {"-X", "--exclude"},
            split = ",",
            description = "Glob of files to exclude, relative to each input directory. Can be repeated.")
    List<String> exclude = new ArrayList<>();

    @CommandLine.Option(names = {"-j", "--jobs"}, description = "Number of worker threads.")
    @Nullable
    Integer jobs;

    @CommandLine.Option(names = "--timeout-seconds", description = "Give up on a single file after this long.")
    @Nullable
    Long timeoutSeconds;

    @CommandLine.Option(
            names = {"-O", "--output-format"},
            converter = OutputFormatConverter.class,
            description = "One of json, yaml, toml, cbor.")
    @Nullable
    OutputFormat format;

    @CommandLine.Option(names = "--pr", description = "Pretty-print JSON output.")
    boolean pretty;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write one file per input into this directory instead of stdout.")
    @Nullable
    Path outputDir;

    @CommandLine.Option(names = "--config", description = "Settings file (default: ./treemetrics.properties).")
    @Nullable
    Path configFile;

    static final class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) {
            return OutputFormat.parse(value)
                    .orElseThrow(() -> new CommandLine.TypeConversionException("Unknown output format: " + value));
        }
    }
}
