package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

public record BinaryNode(ExpressionNode left, Token operator, ExpressionNode right) implements ExpressionNode {

    @Override
    public SourceLocation location() {
        return left.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
