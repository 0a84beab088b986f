package ai.treemetrics.analyzer;

/** Raised before parsing when a file extension or language tag is not supported. */
public class UnsupportedLanguageException extends AnalysisException {
    public UnsupportedLanguageException(String languageOrExtension) {
        super("Unsupported language: " + languageOrExtension);
    }
}
