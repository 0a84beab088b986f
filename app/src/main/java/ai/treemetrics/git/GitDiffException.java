package ai.treemetrics.git;

/** A repository problem that stops a diff report: no repository, shallow history or an unresolvable revision. */
public class GitDiffException extends Exception {
    public GitDiffException(String message) {
        super(message);
    }

    public GitDiffException(String message, Throwable cause) {
        super(message, cause);
    }

    public static GitDiffException notARepository() {
        return new GitDiffException("Not a git repository.");
    }

    public static GitDiffException shallowClone() {
        return new GitDiffException(
                "Shallow clone detected. Use 'actions/checkout' with 'fetch-depth: 0' for full history.");
    }

    public static GitDiffException refNotFound(String rev) {
        return new GitDiffException("Could not resolve ref '" + rev + "'.");
    }
}
