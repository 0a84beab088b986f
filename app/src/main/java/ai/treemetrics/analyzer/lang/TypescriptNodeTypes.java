package ai.treemetrics.analyzer.lang;

/** Node kinds of tree-sitter-typescript (and its TSX dialect) referenced by the classifier. */
public final class TypescriptNodeTypes {
    public static final String PROGRAM = "program";
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String METHOD_DEFINITION = "method_definition";
    public static final String FUNCTION_EXPRESSION = "function_expression";
    /** Older grammars name function expressions {@code function}. */
    public static final String FUNCTION = "function";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String CLASS = "class";
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String ABSTRACT_CLASS_DECLARATION = "abstract_class_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String INTERNAL_MODULE = "internal_module";
    public static final String MODULE = "module";

    public static final String FORMAL_PARAMETERS = "formal_parameters";
    public static final String REQUIRED_PARAMETER = "required_parameter";
    public static final String OPTIONAL_PARAMETER = "optional_parameter";
    public static final String IDENTIFIER = "identifier";

    public static final String IF_STATEMENT = "if_statement";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String TERNARY_EXPRESSION = "ternary_expression";
    public static final String CATCH_CLAUSE = "catch_clause";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOR_IN_STATEMENT = "for_in_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String SWITCH_CASE = "switch_case";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String RETURN_STATEMENT = "return_statement";

    public static final String PUBLIC_FIELD_DEFINITION = "public_field_definition";
    public static final String FIELD_DEFINITION = "field_definition";
    public static final String PROPERTY_SIGNATURE = "property_signature";
    public static final String ACCESSIBILITY_MODIFIER = "accessibility_modifier";
    public static final String PRIVATE_PROPERTY_IDENTIFIER = "private_property_identifier";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String AUGMENTED_ASSIGNMENT_EXPRESSION = "augmented_assignment_expression";
    public static final String UPDATE_EXPRESSION = "update_expression";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";
    public static final String PAIR = "pair";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String NEW_EXPRESSION = "new_expression";
    public static final String COMMENT = "comment";
    public static final String STRING = "string";
    public static final String TEMPLATE_STRING = "template_string";

    private TypescriptNodeTypes() {}
}
