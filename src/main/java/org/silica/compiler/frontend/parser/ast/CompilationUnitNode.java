package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;

import java.util.List;

/**
 * The root of a parsed file or compilation unit.
 *
 * @param members  The top-level members in source order.
 * @param location The location of the start of the unit.
 */
public record CompilationUnitNode(List<AstNode> members, SourceLocation location) implements AstNode {

    public CompilationUnitNode {
        members = List.copyOf(members);
    }

    @Override
    public List<AstNode> getChildren() {
        return members;
    }
}
