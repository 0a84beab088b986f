package ai.treemetrics.analyzer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** The languages the metrics engine understands, with the file extensions that select them. */
public enum Language {
    PYTHON("python", List.of("py", "pyi")),
    GO("go", List.of("go")),
    RUST("rust", List.of("rs")),
    TYPESCRIPT("typescript", List.of("ts", "mts", "cts")),
    TSX("tsx", List.of("tsx"));

    private final String tag;
    private final List<String> extensions;

    Language(String tag, List<String> extensions) {
        this.tag = tag;
        this.extensions = extensions;
    }

    public String tag() {
        return tag;
    }

    public List<String> extensions() {
        return extensions;
    }

    /** Looks up a language by its tag (case-insensitive). */
    public static Optional<Language> fromTag(String tag) {
        var normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(l -> l.tag.equals(normalized)).findFirst();
    }

    /** Looks up a language by a file extension, with or without the leading dot. */
    public static Optional<Language> fromExtension(String extension) {
        var ext = extension.startsWith(".") ? extension.substring(1) : extension;
        var normalized = ext.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.extensions.contains(normalized))
                .findFirst();
    }

    /** Infers the language of a file from the extension of its name. */
    public static Optional<Language> fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(fileName.substring(dot + 1));
    }
}
