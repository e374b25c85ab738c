package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.api.SourceLocation;

/**
 * A top-level member of a library map document.
 */
public sealed interface LibraryMapMember
        permits LibraryDeclaration, LibraryIncludeStatement, ConfigDeclaration, EmptyMember {

    SourceLocation location();
}
