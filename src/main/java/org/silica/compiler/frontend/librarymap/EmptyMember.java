package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.api.SourceLocation;

/**
 * A stray semicolon.
 */
public record EmptyMember(SourceLocation location) implements LibraryMapMember {
}
