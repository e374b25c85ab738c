package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A module, interface, program or package declaration.
 *
 * @param kind           The kind of design element.
 * @param name           The declared name.
 * @param parameterPorts The parameter port list, or {@code null} if the header has none.
 * @param members        The members of the body (parameters, instantiations, imports, nested declarations).
 */
public record ModuleDeclarationNode(
        DeclarationKind kind,
        Token name,
        ParameterPortListNode parameterPorts,
        List<AstNode> members
) implements AstNode {

    public ModuleDeclarationNode {
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
