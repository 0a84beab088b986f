package ai.treemetrics.analyzer;

import java.util.EnumMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRust;
import org.treesitter.TreeSitterTypescript;

/**
 * Parses source text with the tree-sitter grammar of a {@link Language}. Parsers are not thread safe, so each worker
 * thread gets its own parser per language.
 */
public final class TreeSitterParsers {
    private static final Logger logger = LogManager.getLogger(TreeSitterParsers.class);

    /** Angle-bracket casts are not allowed in .tsx files; in a TSX parse they are misread JSX. */
    private static final String TYPE_ASSERTION = "type_assertion";

    private static final ThreadLocal<Map<Language, TSParser>> parserCache =
            ThreadLocal.withInitial(() -> new EnumMap<>(Language.class));

    private TreeSitterParsers() {}

    static TSLanguage createTSLanguage(Language language) {
        return switch (language) {
            case PYTHON -> new TreeSitterPython();
            case GO -> new TreeSitterGo();
            case RUST -> new TreeSitterRust();
            // TSX is parsed with the TypeScript grammar
            case TYPESCRIPT, TSX -> new TreeSitterTypescript();
        };
    }

    private static TSParser parserFor(Language language) {
        return parserCache.get().computeIfAbsent(language, l -> {
            var parser = new TSParser();
            parser.setLanguage(createTSLanguage(l));
            return parser;
        });
    }

    /**
     * Parses {@code content}. A tree containing error nodes is still returned; only a missing tree or a root that is
     * itself an error is rejected.
     */
    public static ParsedSource parse(Language language, SourceContent content) throws MalformedSourceException {
        var parser = parserFor(language);
        var tree = parser.parseString(null, content.text());
        if (tree == null) {
            throw new MalformedSourceException("Parser produced no tree for " + language.tag() + " source");
        }
        var rootNode = tree.getRootNode();
        if (rootNode == null || rootNode.isNull()) {
            throw new MalformedSourceException("Parser produced an empty tree for " + language.tag() + " source");
        }
        var root = new TreeSitterSyntaxNode(rootNode, tree, content);
        if (root.isError()) {
            throw new MalformedSourceException("Source could not be parsed as " + language.tag());
        }
        boolean degraded = root.hasError();
        if (degraded) {
            logger.debug("Parse tree for {} source contains errors", language.tag());
        } else if (language == Language.TSX && !ASTTraversalUtils.findAllByKind(root, TYPE_ASSERTION).isEmpty()) {
            logger.debug("TSX source contains JSX the TypeScript grammar cannot represent");
            degraded = true;
        }
        return new ParsedSource(language, content, root, degraded);
    }
}
