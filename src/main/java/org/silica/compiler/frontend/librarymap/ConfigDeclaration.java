package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.api.SourceLocation;

/**
 * A {@code config ... endconfig} block. Its content is not interpreted.
 */
public record ConfigDeclaration(String name, SourceLocation location) implements LibraryMapMember {
}
