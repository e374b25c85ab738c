package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The type of a declaration that wrote no type, only optional signing and packed dimensions.
 * The type of such a parameter is inferred from its value.
 */
public record ImplicitTypeNode(Token signing, List<RangeNode> dimensions, SourceLocation location) implements DataTypeNode {

    public ImplicitTypeNode {
        dimensions = List.copyOf(dimensions);
    }

    /**
     * @return {@code true} if neither signing nor dimensions were written.
     */
    public boolean isBare() {
        return signing == null && dimensions.isEmpty();
    }
}
