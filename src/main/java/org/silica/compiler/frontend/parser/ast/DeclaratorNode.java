package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A declared parameter name with its optional default value.
 *
 * @param name        The parameter name.
 * @param initializer The default value, or {@code null}.
 */
public record DeclaratorNode(Token name, ExpressionNode initializer) implements AstNode {

    @Override
    public SourceLocation location() {
        return name.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return initializer == null ? List.of() : List.of(initializer);
    }
}
