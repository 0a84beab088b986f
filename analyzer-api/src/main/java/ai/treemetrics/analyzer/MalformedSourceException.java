package ai.treemetrics.analyzer;

/** The parser produced no usable tree for a file. */
public class MalformedSourceException extends AnalysisException {
    public MalformedSourceException(String message) {
        super(message);
    }
}
