package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A built-in type such as {@code logic signed [7:0]} or {@code int}.
 */
public record KeywordTypeNode(Token keyword, Token signing, List<RangeNode> dimensions) implements DataTypeNode {

    public KeywordTypeNode {
        dimensions = List.copyOf(dimensions);
    }

    @Override
    public SourceLocation location() {
        return keyword.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(dimensions);
    }
}
