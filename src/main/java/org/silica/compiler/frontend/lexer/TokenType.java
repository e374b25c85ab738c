package org.silica.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Punctuation.
    /** '(' */
    LEFT_PAREN,
    /** ')' */
    RIGHT_PAREN,
    /** '[' */
    LEFT_BRACKET,
    /** ']' */
    RIGHT_BRACKET,
    /** '{' */
    LEFT_BRACE,
    /** '}' */
    RIGHT_BRACE,
    SEMICOLON,
    COMMA,
    /** '.', used for named connections and hierarchical names. */
    DOT,
    COLON,
    /** '::', the class/package scope operator. */
    DOUBLE_COLON,
    /** '#', introduces parameter value assignments and delays. */
    HASH,
    /** A lone '=' used for assignments and defaults. */
    EQUALS,
    /** A lone apostrophe, as in casts or assignment patterns. */
    APOSTROPHE,
    /** Any other operator, such as '+', '<<' or '=='. */
    OPERATOR,

    // Names & literals.
    /** An identifier, including escaped identifiers. */
    IDENTIFIER,
    /** A system task or function name such as $clog2. */
    SYSTEM_IDENTIFIER,
    /** A reserved keyword such as module or parameter. */
    KEYWORD,
    /** An integer literal, sized or unsized, with an optional base. */
    INTEGER_LITERAL,
    /** A real literal such as 1.5 or 2e-3. */
    REAL_LITERAL,
    /** A string literal. */
    STRING_LITERAL,

    // Preprocessor.
    /** A backtick directive or macro usage such as `define or `WIDTH. */
    DIRECTIVE,
    /** A backslash at the end of a line. */
    LINE_CONTINUATION,
    /** A newline character. */
    NEWLINE,

    /** Represents the end of the source file. */
    END_OF_FILE
}
