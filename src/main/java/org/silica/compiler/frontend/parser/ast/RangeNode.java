package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;

import java.util.List;

/**
 * A packed dimension {@code [left:right]}.
 */
public record RangeNode(ExpressionNode left, ExpressionNode right) implements AstNode {

    @Override
    public SourceLocation location() {
        return left.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
