package org.silica.compiler.frontend.io;

/**
 * Selects what kind of filesystem entries a {@link PathGlob} expansion returns.
 */
public enum GlobMode {
    /** Only regular files. */
    FILES,
    /** Only directories. */
    DIRECTORIES
}
