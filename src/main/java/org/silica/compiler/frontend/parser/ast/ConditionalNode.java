package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;

import java.util.List;

/**
 * The ternary operator {@code cond ? a : b}.
 */
public record ConditionalNode(ExpressionNode condition, ExpressionNode whenTrue, ExpressionNode whenFalse) implements ExpressionNode {

    @Override
    public SourceLocation location() {
        return condition.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, whenTrue, whenFalse);
    }
}
