package ai.treemetrics.analyzer;

/** Base of the per-file failures that stop one file from being analyzed. */
public class AnalysisException extends Exception {
    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
