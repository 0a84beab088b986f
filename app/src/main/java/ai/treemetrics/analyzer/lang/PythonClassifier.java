package ai.treemetrics.analyzer.lang;

import static ai.treemetrics.analyzer.lang.PythonNodeTypes.*;

import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.analyzer.Visibility;
import java.util.Optional;
import java.util.Set;

final class PythonClassifier extends AbstractLanguageClassifier {

    private static final Set<String> OPERATORS = Set.of(
            "import", ".", "from", ",", "as", "*", ">>", "assert", ":=", "return", "def", "del", "raise", "pass",
            "break", "continue", "if", "elif", "else", "async", "for", "in", "while", "try", "except", "finally",
            "with", "->", "=", "global", "exec", "@", "not", "and", "or", "+", "-", "/", "%", "//", "**", "|", "&",
            "^", "<<", "~", "<", "<=", "==", "!=", ">=", ">", "<>", "is", "+=", "-=", "*=", "/=", "@=", "//=", "%=",
            "**=", ">>=", "<<=", "&=", "^=", "|=", "yield", "await", "print");

    private static final Set<String> OPERANDS = Set.of(IDENTIFIER, "integer", "float", "true", "false", "none");

    private static final Set<String> PARAMETER_KINDS = Set.of(
            IDENTIFIER,
            TYPED_PARAMETER,
            DEFAULT_PARAMETER,
            TYPED_DEFAULT_PARAMETER,
            LIST_SPLAT_PATTERN,
            DICTIONARY_SPLAT_PATTERN);

    private static final Set<String> STATEMENTS = Set.of(
            "import_statement",
            "future_import_statement",
            "import_from_statement",
            "print_statement",
            "assert_statement",
            RETURN_STATEMENT,
            "delete_statement",
            "raise_statement",
            "pass_statement",
            "break_statement",
            "continue_statement",
            IF_STATEMENT,
            FOR_STATEMENT,
            WHILE_STATEMENT,
            "try_statement",
            "with_statement",
            "global_statement",
            "nonlocal_statement",
            "exec_statement",
            MATCH_STATEMENT,
            "type_alias_statement",
            EXPRESSION_STATEMENT);

    PythonClassifier() {
        super(Language.PYTHON);
    }

    @Override
    public SemanticCategory classify(SyntaxNode node) {
        var kind = node.kind();
        if (!node.isNamed()) {
            if (("and".equals(kind) || "or".equals(kind)) && BOOLEAN_OPERATOR.equals(parentKind(node))) {
                return SemanticCategory.LOGICAL_AND_OR;
            }
            return OPERATORS.contains(kind) ? SemanticCategory.OPERATOR : SemanticCategory.OTHER;
        }
        if (PARAMETER_KINDS.contains(kind)) {
            var parent = parentKind(node);
            if (PARAMETERS.equals(parent) || LAMBDA_PARAMETERS.equals(parent)) {
                return SemanticCategory.PARAMETER;
            }
        }
        return switch (kind) {
            case FUNCTION_DEFINITION -> SemanticCategory.FUNCTION_BOUNDARY;
            case LAMBDA -> SemanticCategory.CLOSURE_BOUNDARY;
            case CLASS_DEFINITION -> SemanticCategory.TYPE_BOUNDARY;
            case IF_STATEMENT, CONDITIONAL_EXPRESSION, EXCEPT_CLAUSE, EXCEPT_GROUP_CLAUSE -> SemanticCategory.BRANCH;
            case ELIF_CLAUSE -> SemanticCategory.ALTERNATIVE;
            case ELSE_CLAUSE -> SemanticCategory.ELSE;
            case FOR_STATEMENT, WHILE_STATEMENT -> SemanticCategory.LOOP;
            case MATCH_STATEMENT -> SemanticCategory.SWITCH;
            case CASE_CLAUSE -> SemanticCategory.CASE;
            case RETURN_STATEMENT -> SemanticCategory.EXIT_STATEMENT;
            case ASSIGNMENT -> isClassAttribute(node)
                    ? SemanticCategory.ATTRIBUTE_DECLARATION
                    : SemanticCategory.ASSIGNMENT;
            case AUGMENTED_ASSIGNMENT -> SemanticCategory.ASSIGNMENT;
            case CALL -> SemanticCategory.CALL;
            case COMMENT -> SemanticCategory.COMMENT;
            case STRING -> isDocString(node) ? SemanticCategory.COMMENT : SemanticCategory.STRING_LITERAL;
            default -> OPERANDS.contains(kind) ? SemanticCategory.OPERAND : SemanticCategory.OTHER;
        };
    }

    /** A string that is a statement on its own is documentation, not data. */
    private static boolean isDocString(SyntaxNode node) {
        return node.parent()
                .map(p -> EXPRESSION_STATEMENT.equals(p.kind()) && p.childCount() == 1)
                .orElse(false);
    }

    /** {@code x = 1} directly in a class body. */
    private static boolean isClassAttribute(SyntaxNode node) {
        var statement = node.parent().filter(p -> EXPRESSION_STATEMENT.equals(p.kind()));
        var block = statement.flatMap(SyntaxNode::parent).filter(p -> BLOCK.equals(p.kind()));
        return block.flatMap(SyntaxNode::parent)
                .map(p -> CLASS_DEFINITION.equals(p.kind()))
                .orElse(false);
    }

    @Override
    public boolean isStatement(SyntaxNode node) {
        if (!STATEMENTS.contains(node.kind())) {
            return false;
        }
        // docstrings are comments
        return !(EXPRESSION_STATEMENT.equals(node.kind())
                && node.childCount() == 1
                && STRING.equals(node.child(0).kind()));
    }

    @Override
    public Visibility visibility(SyntaxNode node) {
        var name = switch (node.kind()) {
            case FUNCTION_DEFINITION, CLASS_DEFINITION -> node.childByFieldName("name").map(SyntaxNode::text);
            case ASSIGNMENT -> node.childByFieldName("left").map(SyntaxNode::text);
            default -> Optional.<String>empty();
        };
        return name.map(PythonClassifier::visibilityOfName).orElse(Visibility.UNKNOWN);
    }

    static Visibility visibilityOfName(String name) {
        var trimmed = name.trim();
        if (trimmed.startsWith("__") && trimmed.endsWith("__") && trimmed.length() > 4) {
            return Visibility.PUBLIC;
        }
        return trimmed.startsWith("_") ? Visibility.PRIVATE : Visibility.PUBLIC;
    }

    @Override
    protected String anonymousName(SyntaxNode node) {
        if (LAMBDA.equals(node.kind())) {
            return node.parent()
                    .filter(p -> ASSIGNMENT.equals(p.kind()))
                    .flatMap(p -> p.childByFieldName("left"))
                    .map(l -> l.text().trim())
                    .orElse(ANONYMOUS);
        }
        return ANONYMOUS;
    }
}
