package org.silica.compiler.frontend.parser.ast;

/**
 * A constant expression as written in parameter defaults and parameter assignments.
 */
public sealed interface ExpressionNode extends AstNode
        permits LiteralNode, IdentifierNode, ScopedNameNode, UnaryNode, BinaryNode, ConditionalNode,
        SystemCallNode, OpaqueExpressionNode {

    /**
     * @return {@code true} if the expression is a plain or scoped name, which may also denote a type.
     */
    default boolean isNameShaped() {
        return this instanceof IdentifierNode || this instanceof ScopedNameNode;
    }
}
