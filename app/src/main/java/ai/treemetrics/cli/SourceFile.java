package ai.treemetrics.cli;

import java.nio.file.Path;

/**
 * A file selected for analysis.
 *
 * @param path where to read it from
 * @param relativePath its path below the input it was found under, used to name per-file output
 */
public record SourceFile(Path path, Path relativePath) {

    public String unitName() {
        return path.toString();
    }
}
