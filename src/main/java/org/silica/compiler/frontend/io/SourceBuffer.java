package org.silica.compiler.frontend.io;

import org.silica.compiler.frontend.library.SourceLibrary;

import java.nio.file.Path;

/**
 * The loaded text of one source file.
 *
 * @param path    The normalized absolute path, or a synthetic path for in-memory text.
 * @param content The file content with line endings normalized to {@code \n}.
 * @param library The library the file was read for, or {@code null}.
 */
public record SourceBuffer(Path path, String content, SourceLibrary library) {

    /**
     * @return The path as a forward-slash string, used as the logical file name in tokens and diagnostics.
     */
    public String logicalName() {
        return path.toString().replace('\\', '/');
    }
}
