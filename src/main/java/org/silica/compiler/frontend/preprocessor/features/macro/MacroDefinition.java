package org.silica.compiler.frontend.preprocessor.features.macro;

import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A data structure that stores a single macro definition for the preprocessor.
 *
 * @param name         The token containing the name of the macro.
 * @param functionLike Whether the macro was defined with a formal argument list.
 * @param parameters   The formal arguments; empty for object-like macros.
 * @param body         The tokens that make up the body of the macro.
 */
public record MacroDefinition(
        Token name,
        boolean functionLike,
        List<Parameter> parameters,
        List<Token> body
) {

    /**
     * A formal macro argument.
     *
     * @param name         The argument name.
     * @param defaultValue The tokens used when the actual argument is omitted, or {@code null} if it has no default.
     */
    public record Parameter(Token name, List<Token> defaultValue) {
    }

    public MacroDefinition {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }
}
