package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An expression whose structure is not modeled, such as a concatenation or a
 * function call. The tokens are kept so that it can still be reported.
 */
public record OpaqueExpressionNode(List<Token> tokens) implements ExpressionNode {

    public OpaqueExpressionNode {
        tokens = List.copyOf(tokens);
    }

    @Override
    public SourceLocation location() {
        return tokens.isEmpty() ? SourceLocation.NONE : tokens.get(0).location();
    }
}
