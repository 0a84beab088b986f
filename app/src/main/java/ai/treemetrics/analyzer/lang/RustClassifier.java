package ai.treemetrics.analyzer.lang;

import static ai.treemetrics.analyzer.lang.RustNodeTypes.*;

import ai.treemetrics.analyzer.ASTTraversalUtils;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.analyzer.Visibility;
import java.util.Set;

/**
 * Rust. Only a bare {@code pub} makes an item public; {@code pub(crate)} and friends count as private. Items of a
 * trait and of a trait implementation are public through the trait.
 */
final class RustClassifier extends AbstractLanguageClassifier {

    private static final Set<String> OPERATORS = Set.of(
            "(", "{", "[", "=>", "+", "*", "async", "await", "continue", "for", "if", "let", "loop", "match",
            "return", "unsafe", "while", "=", ",", "->", "?", "<", ">", "&", "..", "..=", "-", "&&", "|", "^", "==",
            "!=", "<=", ">=", "<<", ">>", "%", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "move",
            ".", "fn", ";");

    /** Named kinds that still count as operators. */
    private static final Set<String> NAMED_OPERATORS = Set.of("primitive_type", "mutable_specifier");

    private static final Set<String> OPERANDS =
            Set.of("identifier", "integer_literal", "float_literal", "boolean_literal", "self", "_");

    private static final Set<String> PARAMETER_KINDS = Set.of(PARAMETER, SELF_PARAMETER, VARIADIC_PARAMETER);

    private static final Set<String> STATEMENTS =
            Set.of("expression_statement", LET_DECLARATION, "empty_statement");

    RustClassifier() {
        super(Language.RUST);
    }

    @Override
    public SemanticCategory classify(SyntaxNode node) {
        var kind = node.kind();
        if (!node.isNamed()) {
            return classifyToken(node, kind);
        }
        if (PARAMETER_KINDS.contains(kind) && PARAMETERS.equals(parentKind(node))) {
            return SemanticCategory.PARAMETER;
        }
        if (CLOSURE_PARAMETERS.equals(parentKind(node))) {
            return SemanticCategory.PARAMETER;
        }
        return switch (kind) {
            case FUNCTION_ITEM -> SemanticCategory.FUNCTION_BOUNDARY;
            case CLOSURE_EXPRESSION -> SemanticCategory.CLOSURE_BOUNDARY;
            case STRUCT_ITEM, ENUM_ITEM, UNION_ITEM, TRAIT_ITEM, IMPL_ITEM -> SemanticCategory.TYPE_BOUNDARY;
            case MOD_ITEM -> node.childByFieldName("body").isPresent()
                    ? SemanticCategory.NAMESPACE_BOUNDARY
                    : SemanticCategory.OTHER;
            case IF_EXPRESSION, IF_LET_EXPRESSION -> ELSE_CLAUSE.equals(parentKind(node))
                    ? SemanticCategory.ALTERNATIVE
                    : SemanticCategory.BRANCH;
            case ELSE_CLAUSE -> isElseIf(node) ? SemanticCategory.OTHER : SemanticCategory.ELSE;
            case WHILE_EXPRESSION, WHILE_LET_EXPRESSION, LOOP_EXPRESSION, FOR_EXPRESSION -> SemanticCategory.LOOP;
            case MATCH_EXPRESSION -> SemanticCategory.SWITCH;
            case MATCH_ARM -> SemanticCategory.CASE;
            case RETURN_EXPRESSION, TRY_EXPRESSION -> SemanticCategory.EXIT_STATEMENT;
            case FIELD_DECLARATION -> FIELD_DECLARATION_LIST.equals(parentKind(node))
                    ? SemanticCategory.ATTRIBUTE_DECLARATION
                    : SemanticCategory.OTHER;
            case VISIBILITY_MODIFIER -> SemanticCategory.PUBLIC_ATTRIBUTE_MARKER;
            case ASSIGNMENT_EXPRESSION, COMPOUND_ASSIGNMENT_EXPR, LET_DECLARATION -> SemanticCategory.ASSIGNMENT;
            case CALL_EXPRESSION, MACRO_INVOCATION -> SemanticCategory.CALL;
            case LINE_COMMENT, BLOCK_COMMENT -> SemanticCategory.COMMENT;
            case STRING_LITERAL, RAW_STRING_LITERAL, CHAR_LITERAL -> SemanticCategory.STRING_LITERAL;
            default -> {
                if (NAMED_OPERATORS.contains(kind)) {
                    yield SemanticCategory.OPERATOR;
                }
                yield OPERANDS.contains(kind) ? SemanticCategory.OPERAND : SemanticCategory.OTHER;
            }
        };
    }

    private static SemanticCategory classifyToken(SyntaxNode node, String kind) {
        var parent = parentKind(node);
        switch (kind) {
            case "&&", "||" -> {
                // `||` outside a binary expression is an empty closure parameter list
                if (BINARY_EXPRESSION.equals(parent)) {
                    return SemanticCategory.LOGICAL_AND_OR;
                }
                return "&&".equals(kind) ? SemanticCategory.OPERATOR : SemanticCategory.OTHER;
            }
            case "/" -> {
                // the third slash of `///` is not division
                return BINARY_EXPRESSION.equals(parent) ? SemanticCategory.OPERATOR : SemanticCategory.OTHER;
            }
            case "!" -> {
                return INNER_DOC_COMMENT_MARKER.equals(parent) ? SemanticCategory.OTHER : SemanticCategory.OPERATOR;
            }
            case "self", "_" -> {
                return SemanticCategory.OPERAND;
            }
            default -> {
                return OPERATORS.contains(kind) ? SemanticCategory.OPERATOR : SemanticCategory.OTHER;
            }
        }
    }

    private static boolean isElseIf(SyntaxNode elseClause) {
        return ASTTraversalUtils.hasChildOfKind(elseClause, IF_EXPRESSION)
                || ASTTraversalUtils.hasChildOfKind(elseClause, IF_LET_EXPRESSION);
    }

    @Override
    public boolean isStatement(SyntaxNode node) {
        return STATEMENTS.contains(node.kind());
    }

    @Override
    public Visibility visibility(SyntaxNode node) {
        return switch (node.kind()) {
            case FUNCTION_ITEM -> isTraitMember(node) ? Visibility.PUBLIC : explicitVisibility(node);
            case FIELD_DECLARATION, STRUCT_ITEM, ENUM_ITEM, UNION_ITEM, TRAIT_ITEM, MOD_ITEM ->
                explicitVisibility(node);
            default -> Visibility.UNKNOWN;
        };
    }

    private static Visibility explicitVisibility(SyntaxNode node) {
        return ASTTraversalUtils.firstChildOfKind(node, VISIBILITY_MODIFIER)
                .map(v -> "pub".equals(v.text().trim()) ? Visibility.PUBLIC : Visibility.PRIVATE)
                .orElse(Visibility.PRIVATE);
    }

    /** Functions in a trait body or in an {@code impl Trait for T} block. */
    private static boolean isTraitMember(SyntaxNode function) {
        return function.parent()
                .filter(p -> DECLARATION_LIST.equals(p.kind()))
                .flatMap(SyntaxNode::parent)
                .map(owner -> TRAIT_ITEM.equals(owner.kind())
                        || (IMPL_ITEM.equals(owner.kind())
                                && owner.childByFieldName("trait").isPresent()))
                .orElse(false);
    }

    @Override
    public String spaceName(SyntaxNode node) {
        // an impl block is named after the implemented type
        return ASTTraversalUtils.fieldText(node, "name")
                .or(() -> ASTTraversalUtils.fieldText(node, "type"))
                .filter(s -> !s.isEmpty())
                .orElseGet(() -> anonymousName(node));
    }

    @Override
    protected String anonymousName(SyntaxNode node) {
        if (CLOSURE_EXPRESSION.equals(node.kind())) {
            return node.parent()
                    .filter(p -> LET_DECLARATION.equals(p.kind()))
                    .flatMap(p -> ASTTraversalUtils.fieldText(p, "pattern"))
                    .orElse(ANONYMOUS);
        }
        return ANONYMOUS;
    }
}
