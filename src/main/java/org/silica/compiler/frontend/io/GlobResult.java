package org.silica.compiler.frontend.io;

import java.nio.file.Path;
import java.util.List;

/**
 * The outcome of expanding one path pattern.
 *
 * @param rank  The specificity of the pattern.
 * @param paths The matched paths, normalized, absolute and sorted.
 */
public record GlobResult(GlobRank rank, List<Path> paths) {

    public GlobResult {
        paths = List.copyOf(paths);
    }
}
