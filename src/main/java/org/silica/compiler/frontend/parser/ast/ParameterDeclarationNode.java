package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A value parameter declaration, e.g. {@code parameter int W = 8, D = 4}.
 *
 * @param keyword     The {@code parameter}/{@code localparam} keyword or {@code null}.
 * @param type        The declared data type.
 * @param declarators The declared names with their defaults.
 */
public record ParameterDeclarationNode(Token keyword, DataTypeNode type, List<DeclaratorNode> declarators) implements ParamDeclNode {

    public ParameterDeclarationNode {
        declarators = List.copyOf(declarators);
    }

    /**
     * Returns a copy with another declarator appended.
     * @param declarator The declarator to add.
     * @return The extended declaration.
     */
    public ParameterDeclarationNode withDeclarator(DeclaratorNode declarator) {
        List<DeclaratorNode> extended = new ArrayList<>(declarators);
        extended.add(declarator);
        return new ParameterDeclarationNode(keyword, type, extended);
    }

    @Override
    public SourceLocation location() {
        return keyword != null ? keyword.location() : type.location();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(type);
        children.addAll(declarators);
        return children;
    }
}
