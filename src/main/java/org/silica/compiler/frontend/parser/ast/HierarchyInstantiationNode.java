package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An instantiation of a module, interface or program, such as {@code fifo #(.DEPTH(8)) u_fifo (...);}.
 *
 * @param type          The name of the instantiated definition.
 * @param parameters    The parameter value assignment, or {@code null} if none was written.
 * @param instanceNames The names of the created instances.
 */
public record HierarchyInstantiationNode(Token type, ParameterValueAssignmentNode parameters, List<Token> instanceNames) implements AstNode {

    public HierarchyInstantiationNode {
        instanceNames = List.copyOf(instanceNames);
    }

    @Override
    public SourceLocation location() {
        return type.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return parameters == null ? List.of() : List.of(parameters);
    }
}
