package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A class declaration. Only its name, parameters and nested members are kept.
 *
 * @param name           The class name.
 * @param parameterPorts The parameter port list, or {@code null}.
 * @param members        Parameters and nested declarations of the body.
 */
public record ClassDeclarationNode(Token name, ParameterPortListNode parameterPorts, List<AstNode> members) implements AstNode {

    public ClassDeclarationNode {
        members = List.copyOf(members);
    }

    @Override
    public SourceLocation location() {
        return name.location();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (parameterPorts != null) children.add(parameterPorts);
        children.addAll(members);
        return children;
    }
}
