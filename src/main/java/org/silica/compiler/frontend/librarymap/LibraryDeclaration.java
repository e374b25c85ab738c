package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.api.SourceLocation;

import java.util.List;

/**
 * {@code library name path, path [-incdir dir, dir];}
 *
 * @param name        The library name.
 * @param filePaths   The file patterns assigned to the library.
 * @param includeDirs The include directories listed after {@code -incdir}.
 * @param location    The location of the {@code library} keyword.
 */
public record LibraryDeclaration(String name, List<FilePathSpec> filePaths, List<FilePathSpec> includeDirs,
                                 SourceLocation location) implements LibraryMapMember {

    public LibraryDeclaration {
        filePaths = List.copyOf(filePaths);
        includeDirs = List.copyOf(includeDirs);
    }
}
