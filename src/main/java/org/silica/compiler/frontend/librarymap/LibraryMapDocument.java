package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.frontend.io.SourceBuffer;

import java.nio.file.Path;
import java.util.List;

/**
 * A parsed library map file.
 *
 * @param buffer      The text the document was parsed from.
 * @param members     The top-level members in source order.
 * @param diagnostics Syntax errors found while parsing.
 */
public record LibraryMapDocument(SourceBuffer buffer, List<LibraryMapMember> members, DiagnosticsEngine diagnostics) {

    public LibraryMapDocument {
        members = List.copyOf(members);
    }

    /**
     * @return The directory relative paths in this document resolve against.
     */
    public Path directory() {
        Path parent = buffer.path().getParent();
        return parent != null ? parent : buffer.path().toAbsolutePath().getParent();
    }
}
