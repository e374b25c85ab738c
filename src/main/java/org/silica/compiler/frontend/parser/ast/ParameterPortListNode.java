package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The {@code #(...)} parameter port list of a declaration header.
 *
 * @param hash         The '#' token.
 * @param declarations The declarations in source order.
 */
public record ParameterPortListNode(Token hash, List<ParamDeclNode> declarations) implements AstNode {

    public ParameterPortListNode {
        declarations = List.copyOf(declarations);
    }

    @Override
    public SourceLocation location() {
        return hash.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(declarations);
    }
}
