package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A type referenced by name, such as a type parameter or {@code pkg::word_t}.
 *
 * @param name       An {@link IdentifierNode} or {@link ScopedNameNode}.
 * @param dimensions Packed dimensions applied to the named type.
 */
public record NamedTypeNode(ExpressionNode name, List<RangeNode> dimensions) implements DataTypeNode {

    public NamedTypeNode {
        dimensions = List.copyOf(dimensions);
    }

    /**
     * Reinterprets a name-shaped expression as a type reference.
     * @param name The name expression.
     * @return The type node.
     */
    public static NamedTypeNode of(ExpressionNode name) {
        return new NamedTypeNode(name, List.of());
    }

    @Override
    public Token signing() {
        return null;
    }

    @Override
    public SourceLocation location() {
        return name.location();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(name);
    }
}
