package ai.treemetrics.analyzer.lang;

import static ai.treemetrics.analyzer.lang.TypescriptNodeTypes.*;

import ai.treemetrics.analyzer.ASTTraversalUtils;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.analyzer.Visibility;
import java.util.Optional;
import java.util.Set;

/** TypeScript and TSX share one table; the two differ only in the language tag they report. */
final class TypescriptClassifier extends AbstractLanguageClassifier {

    private static final Set<String> OPERATORS = Set.of(
            "export", "import", "extends", ".", "from", "(", ",", "as", "*", ">>", ">>>", ":", "return", "delete",
            "throw", "break", "continue", "if", "else", "switch", "case", "default", "async", "for", "in", "of",
            "while", "try", "catch", "finally", "with", "=", "@", "&&", "||", "+", "-", "--", "++", "/", "%", "**",
            "|", "&", "<<", "~", "<", "<=", "==", "!=", ">=", ">", "+=", "!", "!==", "===", "-=", "*=", "/=", "%=",
            "**=", ">>=", ">>>=", "<<=", "&=", "^", "^=", "|=", "yield", "[", "{", "await", "?", "??", "new", "let",
            "var", "const", "function", ";");

    /** Keywords counted as operands. */
    private static final Set<String> OPERAND_TOKENS = Set.of("void", "typeof", "instanceof", "get", "set");

    private static final Set<String> OPERANDS = Set.of(
            IDENTIFIER,
            "nested_identifier",
            "member_expression",
            "property_identifier",
            "number",
            "true",
            "false",
            "null",
            "undefined",
            "this",
            "super");

    private static final Set<String> STATEMENTS = Set.of(
            "expression_statement",
            "export_statement",
            "import_statement",
            "lexical_declaration",
            "variable_declaration",
            IF_STATEMENT,
            SWITCH_STATEMENT,
            FOR_STATEMENT,
            FOR_IN_STATEMENT,
            WHILE_STATEMENT,
            DO_STATEMENT,
            "try_statement",
            "with_statement",
            "break_statement",
            "continue_statement",
            "debugger_statement",
            RETURN_STATEMENT,
            "throw_statement",
            "empty_statement");

    TypescriptClassifier(Language language) {
        super(language);
    }

    @Override
    public SemanticCategory classify(SyntaxNode node) {
        var kind = node.kind();
        if (!node.isNamed()) {
            if (("&&".equals(kind) || "||".equals(kind)) && BINARY_EXPRESSION.equals(parentKind(node))) {
                return SemanticCategory.LOGICAL_AND_OR;
            }
            if (OPERAND_TOKENS.contains(kind)) {
                return SemanticCategory.OPERAND;
            }
            return OPERATORS.contains(kind) ? SemanticCategory.OPERATOR : SemanticCategory.OTHER;
        }
        return switch (kind) {
            case FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION, METHOD_DEFINITION ->
                SemanticCategory.FUNCTION_BOUNDARY;
            case FUNCTION_EXPRESSION, FUNCTION, GENERATOR_FUNCTION, ARROW_FUNCTION -> SemanticCategory.CLOSURE_BOUNDARY;
            case CLASS, CLASS_DECLARATION, ABSTRACT_CLASS_DECLARATION, INTERFACE_DECLARATION ->
                SemanticCategory.TYPE_BOUNDARY;
            case INTERNAL_MODULE, MODULE -> SemanticCategory.NAMESPACE_BOUNDARY;
            case IF_STATEMENT -> ELSE_CLAUSE.equals(parentKind(node))
                    ? SemanticCategory.ALTERNATIVE
                    : SemanticCategory.BRANCH;
            case ELSE_CLAUSE -> ASTTraversalUtils.hasChildOfKind(node, IF_STATEMENT)
                    ? SemanticCategory.OTHER
                    : SemanticCategory.ELSE;
            case TERNARY_EXPRESSION, CATCH_CLAUSE -> SemanticCategory.BRANCH;
            case FOR_STATEMENT, FOR_IN_STATEMENT, WHILE_STATEMENT, DO_STATEMENT -> SemanticCategory.LOOP;
            case SWITCH_STATEMENT -> SemanticCategory.SWITCH;
            case SWITCH_CASE -> SemanticCategory.CASE;
            case RETURN_STATEMENT -> SemanticCategory.EXIT_STATEMENT;
            case REQUIRED_PARAMETER, OPTIONAL_PARAMETER -> FORMAL_PARAMETERS.equals(parentKind(node))
                    ? SemanticCategory.PARAMETER
                    : SemanticCategory.OTHER;
            case IDENTIFIER -> isArrowParameter(node) ? SemanticCategory.PARAMETER : SemanticCategory.OPERAND;
            case PUBLIC_FIELD_DEFINITION, FIELD_DEFINITION, PROPERTY_SIGNATURE ->
                SemanticCategory.ATTRIBUTE_DECLARATION;
            case ACCESSIBILITY_MODIFIER -> SemanticCategory.PUBLIC_ATTRIBUTE_MARKER;
            case ASSIGNMENT_EXPRESSION, AUGMENTED_ASSIGNMENT_EXPRESSION, UPDATE_EXPRESSION ->
                SemanticCategory.ASSIGNMENT;
            case VARIABLE_DECLARATOR -> node.childByFieldName("value").isPresent()
                    ? SemanticCategory.ASSIGNMENT
                    : SemanticCategory.OTHER;
            case CALL_EXPRESSION, NEW_EXPRESSION -> SemanticCategory.CALL;
            case COMMENT -> SemanticCategory.COMMENT;
            case STRING, TEMPLATE_STRING -> SemanticCategory.STRING_LITERAL;
            default -> OPERANDS.contains(kind) ? SemanticCategory.OPERAND : SemanticCategory.OTHER;
        };
    }

    /** {@code x => x + 1}: the single unparenthesized parameter of an arrow function. */
    private static boolean isArrowParameter(SyntaxNode identifier) {
        return ARROW_FUNCTION.equals(parentKind(identifier)) && isParentField(identifier, "parameter");
    }

    @Override
    public boolean isStatement(SyntaxNode node) {
        return STATEMENTS.contains(node.kind());
    }

    @Override
    public Visibility visibility(SyntaxNode node) {
        return switch (node.kind()) {
            case METHOD_DEFINITION, PUBLIC_FIELD_DEFINITION, FIELD_DEFINITION -> memberVisibility(node);
            case PROPERTY_SIGNATURE -> Visibility.PUBLIC;
            default -> Visibility.UNKNOWN;
        };
    }

    private static Visibility memberVisibility(SyntaxNode member) {
        var modifier = ASTTraversalUtils.firstChildOfKind(member, ACCESSIBILITY_MODIFIER)
                .map(m -> m.text().trim())
                .orElse("public");
        if ("private".equals(modifier) || "protected".equals(modifier)) {
            return Visibility.PRIVATE;
        }
        boolean hashPrivate = member.childByFieldName("name")
                .map(n -> PRIVATE_PROPERTY_IDENTIFIER.equals(n.kind()))
                .orElse(false);
        return hashPrivate ? Visibility.PRIVATE : Visibility.PUBLIC;
    }

    @Override
    protected String anonymousName(SyntaxNode node) {
        // foo: function() {}, const foo = () => {}, foo = () => {} in a class body
        return node.parent()
                .flatMap(parent -> switch (parent.kind()) {
                    case PAIR -> ASTTraversalUtils.fieldText(parent, "key");
                    case VARIABLE_DECLARATOR, PUBLIC_FIELD_DEFINITION, FIELD_DEFINITION ->
                        ASTTraversalUtils.fieldText(parent, "name");
                    case ASSIGNMENT_EXPRESSION -> ASTTraversalUtils.fieldText(parent, "left");
                    default -> Optional.<String>empty();
                })
                .orElse(ANONYMOUS);
    }
}
