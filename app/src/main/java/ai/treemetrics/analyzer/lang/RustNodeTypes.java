package ai.treemetrics.analyzer.lang;

/** Node kinds of tree-sitter-rust referenced by the classifier. */
public final class RustNodeTypes {
    public static final String SOURCE_FILE = "source_file";
    public static final String FUNCTION_ITEM = "function_item";
    public static final String CLOSURE_EXPRESSION = "closure_expression";
    public static final String STRUCT_ITEM = "struct_item";
    public static final String ENUM_ITEM = "enum_item";
    public static final String UNION_ITEM = "union_item";
    public static final String TRAIT_ITEM = "trait_item";
    public static final String IMPL_ITEM = "impl_item";
    public static final String MOD_ITEM = "mod_item";
    public static final String DECLARATION_LIST = "declaration_list";

    public static final String PARAMETERS = "parameters";
    public static final String CLOSURE_PARAMETERS = "closure_parameters";
    public static final String PARAMETER = "parameter";
    public static final String SELF_PARAMETER = "self_parameter";
    public static final String VARIADIC_PARAMETER = "variadic_parameter";

    public static final String IF_EXPRESSION = "if_expression";
    public static final String IF_LET_EXPRESSION = "if_let_expression";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String WHILE_EXPRESSION = "while_expression";
    public static final String WHILE_LET_EXPRESSION = "while_let_expression";
    public static final String LOOP_EXPRESSION = "loop_expression";
    public static final String FOR_EXPRESSION = "for_expression";
    public static final String MATCH_EXPRESSION = "match_expression";
    public static final String MATCH_ARM = "match_arm";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String RETURN_EXPRESSION = "return_expression";
    public static final String TRY_EXPRESSION = "try_expression";

    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String VISIBILITY_MODIFIER = "visibility_modifier";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String COMPOUND_ASSIGNMENT_EXPR = "compound_assignment_expr";
    public static final String LET_DECLARATION = "let_declaration";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String MACRO_INVOCATION = "macro_invocation";
    public static final String LINE_COMMENT = "line_comment";
    public static final String BLOCK_COMMENT = "block_comment";
    public static final String STRING_LITERAL = "string_literal";
    public static final String RAW_STRING_LITERAL = "raw_string_literal";
    public static final String CHAR_LITERAL = "char_literal";
    public static final String INNER_DOC_COMMENT_MARKER = "inner_doc_comment_marker";

    private RustNodeTypes() {}
}
