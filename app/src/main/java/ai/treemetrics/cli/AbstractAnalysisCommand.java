package ai.treemetrics.cli;

import ai.treemetrics.MetricsAnalyzer;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.UnsupportedLanguageException;
import ai.treemetrics.analyzer.space.Space;
import ai.treemetrics.output.MetricsTreeIO;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/** Analyzes every collected file on the batch runner and emits one report per file. */
abstract class AbstractAnalysisCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(AbstractAnalysisCommand.class);

    @CommandLine.Mixin
    AnalysisOptions options = new AnalysisOptions();

    private PrintStream out = System.out;

    /** Redirects stdout reports, for tests. */
    void setOut(PrintStream out) {
        this.out = out;
    }

    /** The value serialized for one file. */
    protected abstract Object report(Space unit);

    @Override
    public Integer call() {
        RunConfig config;
        @Nullable Language forced;
        try {
            config = RunConfig.resolve(options, RunConfig.loadProperties(options.configFile));
            forced = options.language == null ? null : MetricsAnalyzer.languageOfTag(options.language);
        } catch (IllegalArgumentException | UnsupportedLanguageException e) {
            logger.error(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        List<SourceFile> files;
        try {
            files = SourceFileCollector.collect(options.paths, config.filter(), forced != null);
        } catch (IOException e) {
            logger.error(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }
        if (files.isEmpty()) {
            logger.warn("No supported source files found");
            return CommandLine.ExitCode.OK;
        }

        var language = forced;
        var runner = new BatchRunner(config.jobs(), config.timeoutSeconds());
        var summary = runner.run(
                files,
                file -> language == null
                        ? MetricsAnalyzer.analyze(file.path())
                        : MetricsAnalyzer.analyze(file.path(), language),
                (file, unit) -> emit(file, unit, config));
        if (!summary.allSucceeded()) {
            logger.warn("{} of {} files failed", summary.failed(), files.size());
            return CommandLine.ExitCode.SOFTWARE;
        }
        return CommandLine.ExitCode.OK;
    }

    protected void emit(SourceFile file, Space unit, RunConfig config) throws IOException {
        var format = config.formatOrDefault();
        var dto = report(unit);
        if (options.outputDir != null) {
            var target = options.outputDir.resolve(file.relativePath() + "." + format.extension());
            MetricsTreeIO.save(dto, format, config.pretty(), target);
        } else {
            MetricsTreeIO.write(dto, format, config.pretty(), out);
        }
    }

    protected PrintStream out() {
        return out;
    }
}
