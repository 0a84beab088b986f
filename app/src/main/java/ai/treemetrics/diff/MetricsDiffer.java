package ai.treemetrics.diff;

import ai.treemetrics.MetricsAnalyzer;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.MalformedSourceException;
import ai.treemetrics.analyzer.space.Space;
import ai.treemetrics.git.ChangeStatus;
import ai.treemetrics.git.ChangedFile;
import ai.treemetrics.git.GitDiffException;
import ai.treemetrics.git.GitRevisions;
import ai.treemetrics.git.RevisionRange;
import ai.treemetrics.util.GlobFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compares the Unit metrics of every changed source file between two revisions. A file that cannot be read or
 * analyzed at one side counts as absent on that side.
 */
public final class MetricsDiffer {
    private static final Logger logger = LogManager.getLogger(MetricsDiffer.class);

    private final GitRevisions git;
    private final GlobFilter filter;
    private final List<MetricSelector> selectors;

    public MetricsDiffer(GitRevisions git, GlobFilter filter, List<MetricSelector> selectors) {
        this.git = git;
        this.filter = filter;
        this.selectors = List.copyOf(selectors);
    }

    /**
     * @param showUnchanged keep files whose selected metrics did not move
     * @return diffs in report order
     */
    public List<FileDiff> diff(RevisionRange range, boolean showUnchanged) throws GitDiffException {
        var changed = changedFiles(range);
        var diffs = new ArrayList<FileDiff>();
        for (var file : changed) {
            if (!filter.accepts(file.path())) {
                continue;
            }
            var language = Language.fromFileName(file.path());
            if (language.isEmpty()) {
                continue;
            }
            var fileDiff = diffFile(file, language.get(), range);
            if (showUnchanged || !fileDiff.isAllUnchanged()) {
                diffs.add(fileDiff);
            }
        }
        diffs.sort(FileDiff.REPORT_ORDER);
        logger.debug("{} of {} changed files reported", diffs.size(), changed.size());
        return diffs;
    }

    private List<ChangedFile> changedFiles(RevisionRange range) throws GitDiffException {
        var fromCi = range.ciChangedFiles();
        if (fromCi != null) {
            // the payload merges added, modified and removed; both revisions are read anyway
            return fromCi.stream()
                    .map(path -> new ChangedFile(path, ChangeStatus.MODIFIED))
                    .toList();
        }
        return git.changedFiles(range.from(), range.to());
    }

    private FileDiff diffFile(ChangedFile file, Language language, RevisionRange range) {
        boolean isDeleted = file.status() == ChangeStatus.DELETED;
        boolean isAdded = file.status() == ChangeStatus.ADDED;

        var baseline = isAdded ? Optional.<Space>empty() : analyzeAt(range.from(), file.path(), language, "baseline");
        var current = isDeleted ? Optional.<Space>empty() : analyzeAt(range.to(), file.path(), language, "current");
        boolean isNew = isAdded && baseline.isEmpty();

        var metrics = new ArrayList<MetricDiff>();
        for (var selector : selectors) {
            double baselineValue = baseline.map(selector::extract).orElse(0.0);
            double currentValue = current.map(selector::extract).orElse(0.0);
            metrics.add(new MetricDiff(
                    selector.name(),
                    selector.label(),
                    currentValue,
                    baselineValue,
                    currentValue - baselineValue,
                    selector.polarity(),
                    isNew,
                    isDeleted));
        }
        return new FileDiff(file.path(), metrics, isNew, isDeleted);
    }

    private Optional<Space> analyzeAt(String rev, String path, Language language, String side) {
        try {
            var bytes = git.readBlob(rev, path);
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(MetricsAnalyzer.analyze(language, bytes.get(), path));
        } catch (GitDiffException | MalformedSourceException e) {
            logger.warn("Skipping {} for {}: {}", side, path, e.getMessage());
            return Optional.empty();
        }
    }
}
