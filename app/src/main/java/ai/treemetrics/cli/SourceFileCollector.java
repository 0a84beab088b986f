package ai.treemetrics.cli;

import ai.treemetrics.analyzer.Language;
import ai.treemetrics.util.GlobFilter;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Expands command line inputs into source files. Directories are walked recursively in sorted order, skipping hidden
 * directories; their files pass the glob filter on the directory-relative path and must have a supported extension
 * unless a language is forced. Files named explicitly are always taken.
 */
public final class SourceFileCollector {
    private static final Logger logger = LogManager.getLogger(SourceFileCollector.class);

    private SourceFileCollector() {}

    public static List<SourceFile> collect(List<Path> inputs, GlobFilter filter, boolean languageForced)
            throws IOException {
        var seen = new LinkedHashSet<Path>();
        var files = new ArrayList<SourceFile>();
        for (var input : inputs) {
            if (Files.isDirectory(input)) {
                for (var found : walk(input, filter, languageForced)) {
                    if (seen.add(found.path().toAbsolutePath().normalize())) {
                        files.add(found);
                    }
                }
            } else if (Files.isRegularFile(input)) {
                if (seen.add(input.toAbsolutePath().normalize())) {
                    var name = input.getFileName();
                    files.add(new SourceFile(input, name == null ? input : name));
                }
            } else {
                throw new IOException("No such file or directory: " + input);
            }
        }
        logger.debug("Collected {} source files from {} inputs", files.size(), inputs.size());
        return files;
    }

    private static List<SourceFile> walk(Path root, GlobFilter filter, boolean languageForced) throws IOException {
        var found = new ArrayList<SourceFile>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isHidden(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                var relative = root.relativize(file);
                if (!filter.accepts(relative)) {
                    return FileVisitResult.CONTINUE;
                }
                if (!languageForced
                        && Language.fromFileName(file.getFileName().toString()).isEmpty()) {
                    return FileVisitResult.CONTINUE;
                }
                found.add(new SourceFile(file, relative));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        found.sort((a, b) -> a.relativePath().toString().compareTo(b.relativePath().toString()));
        return found;
    }

    private static boolean isHidden(Path dir) {
        var name = dir.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
