package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The {@code #(...)} part of an instantiation.
 *
 * @param hash        The '#' token.
 * @param assignments The actual arguments in source order.
 */
public record ParameterValueAssignmentNode(Token hash, List<ParamAssignmentNode> assignments) implements AstNode {

    public ParameterValueAssignmentNode {
        assignments = List.copyOf(assignments);
    }

    @Override
    public SourceLocation location() {
        return hash.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(assignments);
    }
}
