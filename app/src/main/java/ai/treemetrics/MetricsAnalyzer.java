package ai.treemetrics;

import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.MalformedSourceException;
import ai.treemetrics.analyzer.SourceContent;
import ai.treemetrics.analyzer.TreeSitterParsers;
import ai.treemetrics.analyzer.UnsupportedLanguageException;
import ai.treemetrics.analyzer.lang.Classifiers;
import ai.treemetrics.analyzer.space.Space;
import ai.treemetrics.metrics.MetricEngine;
import ai.treemetrics.space.SpaceTreeBuilder;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of the metrics core: source bytes and a language in, a metrics tree out. Holds no state between calls
 * and may be used from any number of threads.
 */
public final class MetricsAnalyzer {
    private static final Logger logger = LogManager.getLogger(MetricsAnalyzer.class);

    private MetricsAnalyzer() {}

    public static Language languageOf(Path file) throws UnsupportedLanguageException {
        var fileName = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        return Language.fromFileName(fileName).orElseThrow(() -> new UnsupportedLanguageException(fileName));
    }

    public static Language languageOfTag(String tag) throws UnsupportedLanguageException {
        return Language.fromTag(tag).orElseThrow(() -> new UnsupportedLanguageException(tag));
    }

    /** Reads and analyzes a file, inferring its language from the extension. */
    public static Space analyze(Path file) throws UnsupportedLanguageException, MalformedSourceException, IOException {
        return analyze(file, languageOf(file));
    }

    public static Space analyze(Path file, Language language) throws MalformedSourceException, IOException {
        return analyze(language, Files.readAllBytes(file), file.toString());
    }

    /**
     * @throws MalformedSourceException if the bytes are not UTF-8 or the parser yields no usable tree
     */
    public static Space analyze(Language language, byte[] source, String unitName) throws MalformedSourceException {
        SourceContent content;
        try {
            content = SourceContent.decode(source);
        } catch (CharacterCodingException e) {
            throw new MalformedSourceException(unitName + " is not valid UTF-8");
        }
        return analyze(language, content, unitName);
    }

    public static Space analyze(Language language, String source, String unitName) throws MalformedSourceException {
        return analyze(language, SourceContent.of(source), unitName);
    }

    private static Space analyze(Language language, SourceContent content, String unitName)
            throws MalformedSourceException {
        var parsed = TreeSitterParsers.parse(language, content);
        var classifier = Classifiers.forLanguage(language);
        var tree = SpaceTreeBuilder.build(parsed, classifier, unitName);
        if (tree.degraded()) {
            logger.info("{} contains syntax errors; metrics are computed on a partial tree", unitName);
        }
        return MetricEngine.compute(tree);
    }
}
