package ai.treemetrics.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Include/exclude glob filtering of relative paths. An empty include list accepts everything. A leading
 * {@code **}{@code /} also matches paths at the top level, so {@code **}{@code /*.py} accepts {@code a.py}.
 */
public final class GlobFilter {
    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;

    public GlobFilter(List<String> includes, List<String> excludes) {
        this.includes = compile(includes);
        this.excludes = compile(excludes);
    }

    public static GlobFilter acceptAll() {
        return new GlobFilter(List.of(), List.of());
    }

    private static List<PathMatcher> compile(List<String> patterns) {
        var fs = FileSystems.getDefault();
        var matchers = new ArrayList<PathMatcher>();
        for (var pattern : patterns) {
            var trimmed = pattern.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            matchers.add(fs.getPathMatcher("glob:" + trimmed));
            if (trimmed.startsWith("**/")) {
                matchers.add(fs.getPathMatcher("glob:" + trimmed.substring(3)));
            }
        }
        return List.copyOf(matchers);
    }

    public boolean accepts(Path relativePath) {
        boolean included = includes.isEmpty() || includes.stream().anyMatch(m -> m.matches(relativePath));
        return included && excludes.stream().noneMatch(m -> m.matches(relativePath));
    }

    public boolean accepts(String relativePath) {
        return accepts(Path.of(relativePath));
    }
}
