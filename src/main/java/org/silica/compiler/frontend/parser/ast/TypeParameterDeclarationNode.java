package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A type parameter declaration, e.g. {@code parameter type T = logic [7:0]}.
 *
 * @param keyword     The {@code parameter}/{@code localparam} keyword or {@code null}.
 * @param typeKeyword The {@code type} keyword.
 * @param assignments The declared type names with their default types.
 */
public record TypeParameterDeclarationNode(Token keyword, Token typeKeyword, List<TypeAssignmentNode> assignments) implements ParamDeclNode {

    public TypeParameterDeclarationNode {
        assignments = List.copyOf(assignments);
    }

    public TypeParameterDeclarationNode withAssignment(TypeAssignmentNode assignment) {
        List<TypeAssignmentNode> extended = new ArrayList<>(assignments);
        extended.add(assignment);
        return new TypeParameterDeclarationNode(keyword, typeKeyword, extended);
    }

    @Override
    public SourceLocation location() {
        return keyword != null ? keyword.location() : typeKeyword.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(assignments);
    }
}
