package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a simple name, e.g. a parameter name used as a value.
 *
 * @param identifierToken The token of the identifier.
 */
public record IdentifierNode(
        Token identifierToken
) implements ExpressionNode {

    public String name() {
        return identifierToken.name();
    }

    @Override
    public SourceLocation location() {
        return identifierToken.location();
    }
}
