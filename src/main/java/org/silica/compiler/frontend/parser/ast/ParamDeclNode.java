package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.frontend.lexer.Token;

/**
 * A value or type parameter declaration.
 */
public sealed interface ParamDeclNode extends AstNode permits ParameterDeclarationNode, TypeParameterDeclarationNode {

    /**
     * @return The {@code parameter} or {@code localparam} keyword, or {@code null} when it was omitted in a port list.
     */
    Token keyword();

    /**
     * @return {@code true} if the declaration was written with {@code localparam}.
     */
    default boolean isLocalKeyword() {
        return keyword() != null && keyword().text().equals("localparam");
    }
}
