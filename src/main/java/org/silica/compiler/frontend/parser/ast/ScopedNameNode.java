package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

/**
 * A name qualified by a package or class, {@code scope::name}.
 */
public record ScopedNameNode(Token scope, Token name) implements ExpressionNode {

    @Override
    public SourceLocation location() {
        return scope.location();
    }

    @Override
    public String toString() {
        return scope.name() + "::" + name.name();
    }
}
