package ai.treemetrics.analyzer.lang;

/** Node kinds of tree-sitter-go referenced by the classifier. */
public final class GoNodeTypes {
    public static final String SOURCE_FILE = "source_file";
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String FUNC_LITERAL = "func_literal";
    public static final String TYPE_SPEC = "type_spec";
    public static final String STRUCT_TYPE = "struct_type";
    public static final String INTERFACE_TYPE = "interface_type";

    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";
    public static final String VARIADIC_PARAMETER_DECLARATION = "variadic_parameter_declaration";
    public static final String IDENTIFIER = "identifier";

    public static final String IF_STATEMENT = "if_statement";
    public static final String BLOCK = "block";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String EXPRESSION_SWITCH_STATEMENT = "expression_switch_statement";
    public static final String TYPE_SWITCH_STATEMENT = "type_switch_statement";
    public static final String SELECT_STATEMENT = "select_statement";
    public static final String EXPRESSION_CASE = "expression_case";
    public static final String TYPE_CASE = "type_case";
    public static final String COMMUNICATION_CASE = "communication_case";
    public static final String DEFAULT_CASE = "default_case";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String RETURN_STATEMENT = "return_statement";

    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String ASSIGNMENT_STATEMENT = "assignment_statement";
    public static final String SHORT_VAR_DECLARATION = "short_var_declaration";
    public static final String INC_STATEMENT = "inc_statement";
    public static final String DEC_STATEMENT = "dec_statement";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String COMMENT = "comment";
    public static final String INTERPRETED_STRING_LITERAL = "interpreted_string_literal";
    public static final String RAW_STRING_LITERAL = "raw_string_literal";

    private GoNodeTypes() {}
}
