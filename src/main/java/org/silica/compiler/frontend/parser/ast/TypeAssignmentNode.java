package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A declared type parameter name with its optional default type.
 *
 * @param name        The parameter name.
 * @param defaultType The default type, or {@code null}.
 */
public record TypeAssignmentNode(Token name, DataTypeNode defaultType) implements AstNode {

    @Override
    public SourceLocation location() {
        return name.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return defaultType == null ? List.of() : List.of(defaultType);
    }
}
