package org.silica.compiler.frontend.loader;

import org.silica.compiler.frontend.io.SourceBuffer;
import org.silica.compiler.frontend.syntax.SyntaxTree;

import java.io.IOException;

/**
 * The outcome of loading one {@link FileEntry}.
 */
sealed interface LoadResult {

    /** The file was parsed right away. */
    record ParsedTree(SyntaxTree tree) implements LoadResult {
    }

    /**
     * The file was read but must be parsed later.
     *
     * @param buffer          The file content.
     * @param deferredLibrary {@code true} if this is a library file waiting for inherited macros,
     *                        {@code false} if it belongs to the single compilation unit.
     */
    record DeferredBuffer(SourceBuffer buffer, boolean deferredLibrary) implements LoadResult {
    }

    /** The file could not be read. */
    record LoadFailure(FileEntry entry, IOException error) implements LoadResult {
    }
}
