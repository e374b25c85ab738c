package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.api.SourceLocation;

/**
 * {@code include path;}, which pulls in another library map.
 */
public record LibraryIncludeStatement(FilePathSpec path, SourceLocation location) implements LibraryMapMember {
}
