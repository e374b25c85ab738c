package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A call to a system function such as {@code $clog2(DEPTH)}.
 */
public record SystemCallNode(Token name, List<ExpressionNode> arguments) implements ExpressionNode {

    public SystemCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public SourceLocation location() {
        return name.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
