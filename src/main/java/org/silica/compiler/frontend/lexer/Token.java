package org.silica.compiler.frontend.lexer;

import org.silica.compiler.api.SourceLocation;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, keyword, integer literal).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: the {@link IntegerLiteral} of a number,
 *              the {@link Double} of a real, the unquoted content of a string, the name of
 *              a directive without its backtick or of an escaped identifier without its backslash.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name from which this token originates
 *                 (set correctly after preprocessor/include).
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The identifier name of this token; escaped identifiers lose their backslash.
     */
    public String name() {
        return value instanceof String s && type == TokenType.IDENTIFIER ? s : text;
    }

    /**
     * @return The source location of this token.
     */
    public SourceLocation location() {
        return new SourceLocation(fileName, line, column);
    }

    /**
     * Returns a copy of this token that appears to originate from another location.
     * Used when macro bodies are expanded at their usage site.
     *
     * @param location The new location.
     * @return The relocated token.
     */
    public Token relocate(SourceLocation location) {
        return new Token(type, text, value, location.lineNumber(), location.columnNumber(), location.fileName());
    }
}
