package ai.treemetrics.git;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * What a GitHub Actions run tells us about the revisions to compare.
 *
 * @param changedFiles files listed by a push payload, sorted and unique; null when the payload has none
 */
public record CiContext(
        String eventName,
        @Nullable String baseRef,
        @Nullable String headSha,
        @Nullable List<String> changedFiles,
        @Nullable Long prNumber,
        @Nullable String repository) {
    private static final Logger logger = LogManager.getLogger(CiContext.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static Optional<CiContext> detect() {
        return detect(System.getenv());
    }

    /** Reads the GitHub Actions variables from {@code env}; empty when not running under GitHub Actions. */
    public static Optional<CiContext> detect(Map<String, String> env) {
        if (!"true".equals(env.get("GITHUB_ACTIONS"))) {
            return Optional.empty();
        }
        var eventName = env.getOrDefault("GITHUB_EVENT_NAME", "");
        String baseRef = nonEmpty(env.get("GITHUB_BASE_REF"));
        List<String> changedFiles = null;
        Long prNumber = null;

        var payload = readPayload(env.get("GITHUB_EVENT_PATH"));
        if (payload != null) {
            switch (eventName) {
                case "push" -> changedFiles = extractPushChangedFiles(payload).orElse(null);
                case "pull_request" -> {
                    var pr = payload.path("pull_request");
                    if (!pr.isMissingNode()) {
                        if (baseRef == null) {
                            baseRef = textOrNull(pr.path("base").path("ref"));
                        }
                        var number = payload.path("number");
                        prNumber = number.canConvertToLong() ? number.asLong() : null;
                    }
                }
                case "merge_group" -> {
                    if (baseRef == null) {
                        baseRef = textOrNull(payload.path("merge_group").path("base_ref"));
                    }
                }
                default -> {}
            }
        }
        return Optional.of(new CiContext(
                eventName,
                baseRef,
                nonEmpty(env.get("GITHUB_SHA")),
                changedFiles,
                prNumber,
                env.get("GITHUB_REPOSITORY")));
    }

    /** Union of the added, modified and removed lists of every commit in a push payload. */
    public static Optional<List<String>> extractPushChangedFiles(JsonNode payload) {
        var commits = payload.path("commits");
        if (!commits.isArray()) {
            return Optional.empty();
        }
        var files = new TreeSet<String>();
        for (var commit : commits) {
            for (var key : List.of("added", "modified", "removed")) {
                for (var item : commit.path(key)) {
                    if (item.isTextual()) {
                        files.add(item.asText());
                    }
                }
            }
        }
        return files.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(files));
    }

    private static @Nullable JsonNode readPayload(@Nullable String eventPath) {
        if (eventPath == null || eventPath.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readTree(Files.readString(Path.of(eventPath)));
        } catch (IOException e) {
            logger.warn("Could not read GitHub event payload {}: {}", eventPath, e.getMessage());
            return null;
        }
    }

    private static @Nullable String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    private static @Nullable String nonEmpty(@Nullable String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
