package ai.treemetrics.output;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum OutputFormat {
    JSON("json"),
    YAML("yaml"),
    TOML("toml"),
    CBOR("cbor");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public boolean isBinary() {
        return this == CBOR;
    }

    public static Optional<OutputFormat> parse(String value) {
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.extension.equals(normalized)).findFirst();
    }
}
