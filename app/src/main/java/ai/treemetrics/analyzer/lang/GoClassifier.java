package ai.treemetrics.analyzer.lang;

import static ai.treemetrics.analyzer.lang.GoNodeTypes.*;

import ai.treemetrics.analyzer.ASTTraversalUtils;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.analyzer.Visibility;
import java.util.Optional;
import java.util.Set;

/** Go: exported names start with an upper-case letter; methods live outside their type. */
final class GoClassifier extends AbstractLanguageClassifier {

    private static final Set<String> OPERATORS = Set.of(
            // keywords
            "func", "go", "defer", "return", "if", "else", "for", "range", "switch", "select", "case", "default",
            "break", "continue", "goto", "fallthrough", "chan", "map", "struct", "interface", "type", "var", "const",
            "package", "import",
            // punctuation
            ".", ",", ";", ":", ":=", "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "&^=",
            // arithmetic and logic
            "+", "-", "*", "/", "%", "&", "|", "^", "<<", ">>", "&&", "||", "&^", "++", "--", "==", "!=", "<", "<=",
            ">", ">=", "!", "(", "[", "{", "...");

    private static final Set<String> OPERANDS = Set.of(
            IDENTIFIER, "int_literal", "float_literal", "imaginary_literal", "rune_literal", "true", "false", "nil",
            "iota");

    private static final Set<String> STATEMENTS = Set.of(
            "expression_statement",
            "send_statement",
            INC_STATEMENT,
            DEC_STATEMENT,
            ASSIGNMENT_STATEMENT,
            SHORT_VAR_DECLARATION,
            "var_declaration",
            "const_declaration",
            "type_declaration",
            "go_statement",
            "defer_statement",
            RETURN_STATEMENT,
            "break_statement",
            "continue_statement",
            "goto_statement",
            "fallthrough_statement",
            IF_STATEMENT,
            EXPRESSION_SWITCH_STATEMENT,
            TYPE_SWITCH_STATEMENT,
            SELECT_STATEMENT,
            FOR_STATEMENT);

    GoClassifier() {
        super(Language.GO);
    }

    @Override
    public SemanticCategory classify(SyntaxNode node) {
        var kind = node.kind();
        if (!node.isNamed()) {
            if (("&&".equals(kind) || "||".equals(kind)) && BINARY_EXPRESSION.equals(parentKind(node))) {
                return SemanticCategory.LOGICAL_AND_OR;
            }
            return OPERATORS.contains(kind) ? SemanticCategory.OPERATOR : SemanticCategory.OTHER;
        }
        return switch (kind) {
            case FUNCTION_DECLARATION, METHOD_DECLARATION -> SemanticCategory.FUNCTION_BOUNDARY;
            case FUNC_LITERAL -> SemanticCategory.CLOSURE_BOUNDARY;
            case TYPE_SPEC -> isStructOrInterface(node) ? SemanticCategory.TYPE_BOUNDARY : SemanticCategory.OTHER;
            case IF_STATEMENT -> isElseBranch(node) ? SemanticCategory.ALTERNATIVE : SemanticCategory.BRANCH;
            case BLOCK -> isElseBranch(node) ? SemanticCategory.ELSE : SemanticCategory.OTHER;
            case FOR_STATEMENT -> SemanticCategory.LOOP;
            case EXPRESSION_SWITCH_STATEMENT, TYPE_SWITCH_STATEMENT, SELECT_STATEMENT -> SemanticCategory.SWITCH;
            case EXPRESSION_CASE, TYPE_CASE, COMMUNICATION_CASE, DEFAULT_CASE -> SemanticCategory.CASE;
            case RETURN_STATEMENT -> SemanticCategory.EXIT_STATEMENT;
            case PARAMETER_DECLARATION, VARIADIC_PARAMETER_DECLARATION -> hasNames(node)
                    ? SemanticCategory.OTHER
                    : SemanticCategory.PARAMETER;
            case IDENTIFIER -> isParameterName(node) ? SemanticCategory.PARAMETER : SemanticCategory.OPERAND;
            case FIELD_DECLARATION -> FIELD_DECLARATION_LIST.equals(parentKind(node))
                    ? SemanticCategory.ATTRIBUTE_DECLARATION
                    : SemanticCategory.OTHER;
            case ASSIGNMENT_STATEMENT, SHORT_VAR_DECLARATION, INC_STATEMENT, DEC_STATEMENT ->
                SemanticCategory.ASSIGNMENT;
            case CALL_EXPRESSION -> SemanticCategory.CALL;
            case COMMENT -> SemanticCategory.COMMENT;
            case INTERPRETED_STRING_LITERAL, RAW_STRING_LITERAL -> SemanticCategory.STRING_LITERAL;
            default -> OPERANDS.contains(kind) ? SemanticCategory.OPERAND : SemanticCategory.OTHER;
        };
    }

    private static boolean isStructOrInterface(SyntaxNode typeSpec) {
        return typeSpec.childByFieldName("type")
                .map(t -> STRUCT_TYPE.equals(t.kind()) || INTERFACE_TYPE.equals(t.kind()))
                .orElse(false);
    }

    /** The {@code else} part of an if statement: either a nested if (else-if) or a block. */
    private static boolean isElseBranch(SyntaxNode node) {
        return IF_STATEMENT.equals(parentKind(node)) && isParentField(node, "alternative");
    }

    private static boolean hasNames(SyntaxNode declaration) {
        return ASTTraversalUtils.hasChildOfKind(declaration, IDENTIFIER);
    }

    /** Each name in {@code a, b int} is one parameter. */
    private static boolean isParameterName(SyntaxNode identifier) {
        var parent = parentKind(identifier);
        return PARAMETER_DECLARATION.equals(parent) || VARIADIC_PARAMETER_DECLARATION.equals(parent);
    }

    @Override
    public boolean isStatement(SyntaxNode node) {
        return STATEMENTS.contains(node.kind());
    }

    @Override
    public Visibility visibility(SyntaxNode node) {
        var name = switch (node.kind()) {
            case FUNCTION_DECLARATION, METHOD_DECLARATION, TYPE_SPEC -> node.childByFieldName("name")
                    .map(SyntaxNode::text);
            case FIELD_DECLARATION -> fieldName(node);
            default -> Optional.<String>empty();
        };
        return name.map(GoClassifier::visibilityOfName).orElse(Visibility.UNKNOWN);
    }

    /** First declared name, or the type name of an embedded field. */
    private static Optional<String> fieldName(SyntaxNode field) {
        var declared = field.childByFieldName("name").map(SyntaxNode::text);
        if (declared.isPresent()) {
            return declared;
        }
        return field.childByFieldName("type").map(t -> {
            var text = t.text().trim();
            while (text.startsWith("*")) {
                text = text.substring(1);
            }
            int dot = text.lastIndexOf('.');
            return dot >= 0 ? text.substring(dot + 1) : text;
        });
    }

    static Visibility visibilityOfName(String name) {
        var trimmed = name.trim();
        if (trimmed.isEmpty()) {
            return Visibility.UNKNOWN;
        }
        return Character.isUpperCase(trimmed.codePointAt(0)) ? Visibility.PUBLIC : Visibility.PRIVATE;
    }
}
