package org.pragmatica.rewrite.tree;

/**
 * Closed set of syntactic kinds. Every kind declares which child kinds it may own;
 * {@link Tree.Node} refuses to be built with anything else.
 */
public enum Kind {
    COMPILATION_UNIT,
    PACKAGE_DECLARATION,
    IMPORT,
    CLASS_DECLARATION,
    MODIFIER,
    ANNOTATION,
    BLOCK,
    METHOD_DECLARATION,
    VARIABLE_DECLARATIONS,
    NAMED_VARIABLE,
    RETURN,
    IF,
    EXPRESSION_STATEMENT,
    METHOD_INVOCATION,
    NEW_CLASS,
    FIELD_ACCESS,
    IDENTIFIER,
    LITERAL,
    UNARY,
    BINARY,
    ASSIGNMENT,
    PARENTHESES,
    PRIMITIVE_TYPE,
    PARAMETERIZED_TYPE,
    ARRAY_TYPE,
    TOKEN;

    /**
     * Whether a node of this kind may own a child of the given kind.
     */
    public boolean accepts(Kind child) {
        return switch (this) {
            case COMPILATION_UNIT -> child == PACKAGE_DECLARATION
                                     || child == IMPORT
                                     || child == CLASS_DECLARATION
                                     || child == TOKEN;
            case PACKAGE_DECLARATION, IMPORT -> child == IDENTIFIER || child == FIELD_ACCESS || child == TOKEN;
            case CLASS_DECLARATION -> child == MODIFIER
                                      || child == ANNOTATION
                                      || child == BLOCK
                                      || child.isType()
                                      || child == TOKEN;
            case MODIFIER, IDENTIFIER, LITERAL, PRIMITIVE_TYPE -> child == TOKEN;
            case ANNOTATION -> child.isExpression() || child == TOKEN;
            case BLOCK -> child.isStatement() || child == METHOD_DECLARATION || child == TOKEN;
            case METHOD_DECLARATION -> child == MODIFIER
                                       || child == ANNOTATION
                                       || child == VARIABLE_DECLARATIONS
                                       || child == BLOCK
                                       || child.isType()
                                       || child == TOKEN;
            case VARIABLE_DECLARATIONS -> child == MODIFIER
                                          || child == ANNOTATION
                                          || child == NAMED_VARIABLE
                                          || child.isType()
                                          || child == TOKEN;
            case NAMED_VARIABLE, RETURN, EXPRESSION_STATEMENT, METHOD_INVOCATION, FIELD_ACCESS, UNARY, BINARY,
                 ASSIGNMENT, PARENTHESES -> child.isExpression() || child == TOKEN;
            case IF -> child.isExpression() || child.isStatement() || child == TOKEN;
            case NEW_CLASS -> child.isExpression() || child.isType() || child == TOKEN;
            case PARAMETERIZED_TYPE, ARRAY_TYPE -> child.isType() || child == TOKEN;
            case TOKEN -> false;
        };
    }

    public boolean isExpression() {
        return switch (this) {
            case METHOD_INVOCATION, NEW_CLASS, FIELD_ACCESS, IDENTIFIER, LITERAL, UNARY, BINARY, ASSIGNMENT,
                 PARENTHESES -> true;
            case COMPILATION_UNIT, PACKAGE_DECLARATION, IMPORT, CLASS_DECLARATION, MODIFIER, ANNOTATION, BLOCK,
                 METHOD_DECLARATION, VARIABLE_DECLARATIONS, NAMED_VARIABLE, RETURN, IF, EXPRESSION_STATEMENT,
                 PRIMITIVE_TYPE, PARAMETERIZED_TYPE, ARRAY_TYPE, TOKEN -> false;
        };
    }

    public boolean isType() {
        return switch (this) {
            case IDENTIFIER, FIELD_ACCESS, PRIMITIVE_TYPE, PARAMETERIZED_TYPE, ARRAY_TYPE -> true;
            default -> false;
        };
    }

    public boolean isStatement() {
        return switch (this) {
            case BLOCK, RETURN, IF, EXPRESSION_STATEMENT, VARIABLE_DECLARATIONS, CLASS_DECLARATION -> true;
            default -> false;
        };
    }

    /**
     * Kinds whose nodes wrap exactly one token.
     */
    public boolean isSingleToken() {
        return this == MODIFIER || this == IDENTIFIER || this == LITERAL || this == PRIMITIVE_TYPE;
    }
}
