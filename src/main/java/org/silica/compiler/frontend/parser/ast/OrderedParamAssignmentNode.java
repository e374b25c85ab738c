package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;

import java.util.List;

/**
 * A positional parameter argument.
 *
 * @param value An {@link ExpressionNode} or a {@link DataTypeNode}.
 */
public record OrderedParamAssignmentNode(AstNode value) implements ParamAssignmentNode {

    @Override
    public SourceLocation location() {
        return value.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
