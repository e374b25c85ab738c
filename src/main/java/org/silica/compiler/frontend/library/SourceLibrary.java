package org.silica.compiler.frontend.library;

/**
 * A named source library. Libraries live in a {@link LibraryRegistry} for the whole
 * session; everything else refers to them by {@link #handle()}.
 *
 * @param name   The library name as written in a library map or on the command line.
 * @param handle The index of this library inside its registry.
 */
public record SourceLibrary(String name, int handle) {

    /** Handle value meaning "no library". */
    public static final int NO_HANDLE = -1;

    @Override
    public String toString() {
        return name;
    }
}
