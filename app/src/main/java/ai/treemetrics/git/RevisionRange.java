package ai.treemetrics.git;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The two revisions a diff report compares, plus the changed files a CI payload already listed, if any.
 */
public record RevisionRange(String from, String to, @Nullable List<String> ciChangedFiles) {

    /**
     * Explicit revisions win; otherwise they are derived from the CI context, falling back to {@code main..HEAD}.
     */
    public static RevisionRange resolve(
            @Nullable String explicitFrom, @Nullable String explicitTo, Optional<CiContext> ci) {
        if (ci.isEmpty()) {
            return new RevisionRange(
                    explicitFrom != null ? explicitFrom : "main", explicitTo != null ? explicitTo : "HEAD", null);
        }
        var context = ci.get();
        var to = explicitTo != null ? explicitTo : context.headSha() != null ? context.headSha() : "HEAD";
        var from = explicitFrom != null ? explicitFrom : defaultFrom(context);
        var changed = "push".equals(context.eventName()) ? context.changedFiles() : null;
        return new RevisionRange(from, to, changed);
    }

    private static String defaultFrom(CiContext context) {
        return switch (context.eventName()) {
            case "push" -> "HEAD~1";
            case "pull_request", "merge_group" ->
                context.baseRef() != null ? "origin/" + context.baseRef() : "origin/main";
            default -> "main";
        };
    }
}
