package org.silica.compiler.diagnostics;

/**
 * Defines unique, testable codes for every diagnostic the front end can report.
 * This decouples the test logic from the message texts.
 */
public enum DiagCode {
    // region Lexer & Preprocessor
    /** A character that cannot start any token. */
    UNEXPECTED_CHARACTER(Diagnostic.Type.ERROR, "unexpected character '%s'"),
    /** A string literal reaches the end of the line or file without a closing quote. */
    UNTERMINATED_STRING(Diagnostic.Type.ERROR, "unterminated string literal"),
    /** A block comment is never closed. */
    UNTERMINATED_BLOCK_COMMENT(Diagnostic.Type.ERROR, "block comment is never closed"),
    /** A malformed numeric literal. */
    INVALID_NUMBER(Diagnostic.Type.ERROR, "invalid numeric literal '%s'"),
    /** A macro usage or directive name that is not defined. */
    UNKNOWN_DIRECTIVE(Diagnostic.Type.ERROR, "unknown macro or compiler directive '`%s'"),
    /** A directive that needs a name did not get one. */
    EXPECTED_MACRO_NAME(Diagnostic.Type.ERROR, "expected a macro name after '`%s'"),
    /** Wrong number of actual arguments for a function-like macro. */
    MACRO_ARGUMENT_COUNT(Diagnostic.Type.ERROR, "macro '%s' expects %d argument(s) but %d were given"),
    /** A function-like macro was used without an argument list. */
    EXPECTED_MACRO_ARGS(Diagnostic.Type.ERROR, "expected argument list for macro '%s'"),
    /** `else, `elsif or `endif without an opening conditional. */
    UNBALANCED_CONDITIONAL(Diagnostic.Type.ERROR, "'`%s' without a matching '`ifdef' or '`ifndef'"),
    /** A conditional block is never closed. */
    MISSING_ENDIF(Diagnostic.Type.ERROR, "missing '`endif' for conditional directive"),
    /** An included file could not be read. */
    COULD_NOT_OPEN_INCLUDE(Diagnostic.Type.ERROR, "could not open include file '%s': %s"),
    /** An include directive without a file name. */
    EXPECTED_INCLUDE_FILE(Diagnostic.Type.ERROR, "expected an include file name"),
    /** A file includes itself, directly or indirectly. */
    RECURSIVE_INCLUDE(Diagnostic.Type.ERROR, "file '%s' includes itself recursively"),
    /** Macro expansion exceeded the nesting limit. */
    MACRO_EXPANSION_TOO_DEEP(Diagnostic.Type.ERROR, "expansion of macro '%s' is nested too deeply"),
    // endregion

    // region Parser
    /** A specific token was expected. */
    EXPECTED_TOKEN(Diagnostic.Type.ERROR, "expected %s"),
    /** A declaration is not terminated by its end keyword. */
    MISSING_END_KEYWORD(Diagnostic.Type.ERROR, "missing '%s' for '%s'"),
    /** An expression was expected. */
    EXPECTED_EXPRESSION(Diagnostic.Type.ERROR, "expected expression"),
    // endregion

    // region Library maps
    /** A library map member that is none of config, include or library. */
    EXPECTED_LIBRARY_MAP_MEMBER(Diagnostic.Type.ERROR, "expected 'library', 'include' or 'config' but found '%s'"),
    /** A library declaration without a name. */
    EXPECTED_LIBRARY_NAME(Diagnostic.Type.ERROR, "expected library name"),
    /** A file path specification was expected. */
    EXPECTED_FILE_PATH(Diagnostic.Type.ERROR, "expected file path specification"),
    /** A config declaration is never closed. */
    MISSING_ENDCONFIG(Diagnostic.Type.ERROR, "missing 'endconfig' for config '%s'"),
    // endregion

    // region Parameters
    /** An instantiation mixes ordered and named parameter assignments. */
    MIXING_ORDERED_AND_NAMED_PARAMS(Diagnostic.Type.ERROR, "mixing ordered and named parameter assignments is not allowed"),
    /** The same parameter is assigned twice by name. */
    DUPLICATE_PARAM_ASSIGNMENT(Diagnostic.Type.ERROR, "duplicate assignment for parameter '%s'"),
    /** More ordered assignments than non-local parameters. */
    TOO_MANY_PARAM_ASSIGNMENTS(Diagnostic.Type.ERROR, "too many parameter assignments given for '%s' (%d given, expected %d)"),
    /** A named assignment targets a local port parameter. */
    ASSIGNED_TO_LOCAL_PORT_PARAM(Diagnostic.Type.ERROR, "can't assign a value to a localparam"),
    /** A named assignment targets a body parameter that is local. */
    ASSIGNED_TO_LOCAL_BODY_PARAM(Diagnostic.Type.ERROR,
            "can't assign a value to a localparam (parameters in the body of a definition with a parameter port list are local)"),
    /** A named assignment names a parameter the definition does not have. */
    PARAMETER_DOES_NOT_EXIST(Diagnostic.Type.ERROR, "'%s' is not a parameter of '%s'"),
    /** A port parameter without default received no value. */
    PARAM_HAS_NO_VALUE(Diagnostic.Type.ERROR,
            "instance of '%s' does not provide a value for parameter '%s' and it does not have a default value"),
    /** The actual argument of a type parameter is not a type. */
    BAD_TYPE_PARAM_EXPR(Diagnostic.Type.ERROR, "invalid expression for type parameter '%s'"),
    // endregion

    // region Binding & Evaluation
    /** A name that does not resolve to anything in scope. */
    UNDECLARED_IDENTIFIER(Diagnostic.Type.ERROR, "use of undeclared identifier '%s'"),
    /** A type name that does not resolve. */
    UNKNOWN_TYPE(Diagnostic.Type.ERROR, "unknown type '%s'"),
    /** A name used as a type resolves to something else. */
    NOT_A_TYPE(Diagnostic.Type.ERROR, "'%s' is not a type"),
    /** A type name was used where a value is required. */
    NOT_A_VALUE(Diagnostic.Type.ERROR, "'%s' is a type and cannot be used as a value"),
    /** An expression that cannot be evaluated at elaboration time. */
    EXPRESSION_NOT_CONSTANT(Diagnostic.Type.ERROR, "expression is not constant"),
    /** Operand types that the operator does not accept. */
    BAD_OPERAND_TYPES(Diagnostic.Type.ERROR, "invalid operands to operator '%s'"),
    /** Division or modulo by zero in a constant expression. */
    DIVIDE_BY_ZERO(Diagnostic.Type.WARNING, "division by zero in constant expression"),
    /** The packed dimensions of a type multiply to more bits than supported. */
    PACKED_TYPE_TOO_LARGE(Diagnostic.Type.ERROR, "packed type of %s bits exceeds the maximum of %s bits"),
    /** A value cannot be converted to the declared type. */
    BAD_CONVERSION(Diagnostic.Type.ERROR, "value of type '%s' cannot be converted to '%s'"),
    /** A parameter initializer depends on itself. */
    RECURSIVE_DEFINITION(Diagnostic.Type.ERROR, "'%s' recursively depends on its own value"),
    /** A system function that cannot be evaluated at elaboration time. */
    UNKNOWN_SYSTEM_FUNCTION(Diagnostic.Type.ERROR, "unknown or non-constant system function '%s'"),
    /** A system function called with the wrong number of arguments. */
    WRONG_ARGUMENT_COUNT(Diagnostic.Type.ERROR, "'%s' expects %d argument(s) but %d were given"),
    /** An instantiation names a definition that was never loaded. */
    UNKNOWN_DEFINITION(Diagnostic.Type.ERROR, "unknown module, interface or program '%s'"),
    /** A definition instantiates itself, directly or through its children. */
    RECURSIVE_INSTANTIATION(Diagnostic.Type.ERROR, "'%s' recursively instantiates itself"),
    /** The same name is declared twice in one scope. */
    REDEFINITION(Diagnostic.Type.ERROR, "redefinition of '%s'"),
    // endregion

    // region Notes
    /** Points at an earlier use of the same name. */
    NOTE_PREVIOUS_USAGE(Diagnostic.Type.NOTE, "previous usage here"),
    /** Points at a declaration. */
    NOTE_DECLARATION_HERE(Diagnostic.Type.NOTE, "declared here"),
    /** Points at an earlier definition. */
    NOTE_PREVIOUS_DEFINITION(Diagnostic.Type.NOTE, "previous definition here");
    // endregion

    private final Diagnostic.Type severity;
    private final String messageFormat;

    DiagCode(Diagnostic.Type severity, String messageFormat) {
        this.severity = severity;
        this.messageFormat = messageFormat;
    }

    /**
     * @return The default severity of diagnostics with this code.
     */
    public Diagnostic.Type severity() {
        return severity;
    }

    /**
     * Formats the message of this code with the given arguments.
     * @param args The arguments referenced by the message format.
     * @return The formatted message.
     */
    public String format(Object... args) {
        return args.length == 0 ? messageFormat : String.format(messageFormat, args);
    }
}
