package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

/**
 * An integer, real or string literal.
 */
public record LiteralNode(Token token) implements ExpressionNode {

    @Override
    public SourceLocation location() {
        return token.location();
    }
}
