package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A written data type.
 */
public sealed interface DataTypeNode extends AstNode permits KeywordTypeNode, NamedTypeNode, ImplicitTypeNode {

    /**
     * @return The packed dimensions, outermost first.
     */
    List<RangeNode> dimensions();

    /**
     * @return The {@code signed}/{@code unsigned} keyword, or {@code null}.
     */
    Token signing();
}
