package ai.treemetrics.analyzer.lang;

import ai.treemetrics.analyzer.ASTTraversalUtils;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;

/** Shared plumbing of the per-language tables. */
abstract class AbstractLanguageClassifier implements LanguageClassifier {
    static final String ANONYMOUS = "<anonymous>";

    private final Language language;

    protected AbstractLanguageClassifier(Language language) {
        this.language = language;
    }

    @Override
    public final Language language() {
        return language;
    }

    @Override
    public boolean isComment(SyntaxNode node) {
        return classify(node) == SemanticCategory.COMMENT;
    }

    @Override
    public String spaceName(SyntaxNode node) {
        return ASTTraversalUtils.fieldText(node, "name")
                .filter(s -> !s.isEmpty())
                .orElseGet(() -> anonymousName(node));
    }

    /** Name for a boundary without a name field, e.g. a closure bound to a variable. */
    protected String anonymousName(SyntaxNode node) {
        return ANONYMOUS;
    }

    static String parentKind(SyntaxNode node) {
        return node.parent().map(SyntaxNode::kind).orElse("");
    }

    /** True if {@code node} is stored under {@code fieldName} of its parent. */
    static boolean isParentField(SyntaxNode node, String fieldName) {
        return node.parent().map(p -> p.isField(fieldName, node)).orElse(false);
    }
}
