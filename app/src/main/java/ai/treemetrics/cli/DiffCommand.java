package ai.treemetrics.cli;

import ai.treemetrics.diff.DiffFormat;
import ai.treemetrics.diff.DiffReport;
import ai.treemetrics.diff.MetricSelector;
import ai.treemetrics.diff.MetricsDiffer;
import ai.treemetrics.git.CiContext;
import ai.treemetrics.git.GitDiffException;
import ai.treemetrics.git.GitRevisions;
import ai.treemetrics.git.RevisionRange;
import ai.treemetrics.util.GlobFilter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "diff",
        mixinStandardHelpOptions = true,
        description = "Compare file-level metrics of changed files between two git revisions.")
public final class DiffCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(DiffCommand.class);

    @CommandLine.Option(names = "--from", description = "Base revision to compare from.")
    @Nullable
    String from;

    @CommandLine.Option(names = "--to", description = "Head revision to compare to.")
    @Nullable
    String to;

    @CommandLine.Option(
            names = {"-M", "--metrics"},
            split = ",",
            description = "Metrics to compare (default: cyclomatic,cognitive,nom.functions,loc.lloc). Prefix + for"
                    + " higher-is-better, - for lower-is-better.")
    List<String> metrics = new ArrayList<>();

    @CommandLine.Option(names = {"-I", "--include"}, split = ",", description = "Glob of files to include.")
    List<String> include = new ArrayList<>();

    @CommandLine.Option(names = {"-X", "--exclude"}, split = ",", description = "Glob of files to exclude.")
    List<String> exclude = new ArrayList<>();

    @CommandLine.Option(
            names = {"-O", "--output-format"},
            description = "Report format: ${COMPLETION-CANDIDATES}.",
            defaultValue = "MARKDOWN",
            converter = DiffFormatConverter.class)
    DiffFormat format = DiffFormat.MARKDOWN;

    @CommandLine.Option(names = "--show-unchanged", description = "Also list files whose metrics did not change.")
    boolean showUnchanged;

    @CommandLine.Option(names = "--repo", description = "Directory inside the repository (default: current).")
    Path repoDir = Path.of(".");

    private Map<String, String> env = System.getenv();
    private PrintStream out = System.out;

    /** Replaces the process environment and stdout, for tests. */
    void redirect(Map<String, String> env, PrintStream out) {
        this.env = env;
        this.out = out;
    }

    @Override
    public Integer call() {
        var range = RevisionRange.resolve(from, to, CiContext.detect(env));
        var selectors = MetricSelector.parse(metrics);
        logger.debug("Comparing {}..{} on {} metrics", range.from(), range.to(), selectors.size());

        try (var git = GitRevisions.open(repoDir)) {
            var fromLabel = git.friendlyRefLabel(range.from());
            var differ = new MetricsDiffer(git, new GlobFilter(include, exclude), selectors);
            var diffs = differ.diff(range, showUnchanged);
            var report = switch (format) {
                case MARKDOWN -> DiffReport.markdown(diffs, selectors, fromLabel, range.from(), range.to());
                case JSON -> DiffReport.json(diffs);
            };
            out.print(report);
            out.flush();
            return CommandLine.ExitCode.OK;
        } catch (GitDiffException e) {
            logger.error(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (IOException e) {
            logger.error("Failed to render diff report", e);
            return CommandLine.ExitCode.SOFTWARE;
        }
    }

    static final class DiffFormatConverter implements CommandLine.ITypeConverter<DiffFormat> {
        @Override
        public DiffFormat convert(String value) {
            return DiffFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
