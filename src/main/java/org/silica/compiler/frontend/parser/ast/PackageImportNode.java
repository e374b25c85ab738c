package org.silica.compiler.frontend.parser.ast;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.lexer.Token;

/**
 * One item of an {@code import} declaration, such as {@code pkg::*} or {@code pkg::item}.
 *
 * @param packageName The imported package.
 * @param item        The imported name, or {@code null} for a wildcard import.
 */
public record PackageImportNode(Token packageName, Token item) implements AstNode {

    public boolean isWildcard() {
        return item == null;
    }

    @Override
    public SourceLocation location() {
        return packageName.location();
    }
}
