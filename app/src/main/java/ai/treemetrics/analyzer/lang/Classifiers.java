package ai.treemetrics.analyzer.lang;

import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.LanguageClassifier;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Read-only registry of the classifier table of every supported language. */
public final class Classifiers {
    private static final Map<Language, LanguageClassifier> BY_LANGUAGE;

    static {
        var map = new EnumMap<Language, LanguageClassifier>(Language.class);
        map.put(Language.PYTHON, new PythonClassifier());
        map.put(Language.GO, new GoClassifier());
        map.put(Language.RUST, new RustClassifier());
        map.put(Language.TYPESCRIPT, new TypescriptClassifier(Language.TYPESCRIPT));
        map.put(Language.TSX, new TypescriptClassifier(Language.TSX));
        BY_LANGUAGE = Collections.unmodifiableMap(map);
    }

    private Classifiers() {}

    public static LanguageClassifier forLanguage(Language language) {
        var classifier = BY_LANGUAGE.get(language);
        if (classifier == null) {
            throw new IllegalStateException("No classifier registered for " + language);
        }
        return classifier;
    }
}
