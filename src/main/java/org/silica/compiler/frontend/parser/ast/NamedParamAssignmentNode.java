package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A named parameter argument {@code .NAME(value)}.
 *
 * @param dot   The leading '.' token.
 * @param name  The parameter name.
 * @param value An {@link ExpressionNode} or a {@link DataTypeNode}; {@code null} for {@code .NAME()}.
 */
public record NamedParamAssignmentNode(Token dot, Token name, AstNode value) implements ParamAssignmentNode {

    @Override
    public SourceLocation location() {
        return dot.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }
}
