package org.snrasm.compiler.frontend.parser.cst;

/**
 * The kinds of inner nodes of the concrete syntax tree.
 */
public enum SyntaxKind {
    SOURCE_FILE,
    JUMP_TABLE_BLOCK,
    SCRIPT_BLOCK,
    FUNCTION_DEF,
    SUBROUTINE_DEF,
    ALIAS_DEF,
    PARAM_LIST,
    PRESERVED_LIST,
    REGISTER_RANGE,
    LABEL,
    INSTRUCTION,
    ARGUMENT_LIST,
    FLAG,

    // Expressions.
    LITERAL,
    REGISTER_REF,
    NAME_REF,
    BINARY_EXPR,
    PREFIX_EXPR,
    PAREN_EXPR,
    CALL_EXPR,
    MAPPING_EXPR,
    MAPPING_ENTRY,
    ARRAY_EXPR,

    ERROR;

    public boolean isExpression() {
        return ordinal() >= LITERAL.ordinal() && ordinal() <= ARRAY_EXPR.ordinal();
    }
}
