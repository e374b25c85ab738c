package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

public record UnaryNode(Token operator, ExpressionNode operand) implements ExpressionNode {

    @Override
    public SourceLocation location() {
        return operator.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
