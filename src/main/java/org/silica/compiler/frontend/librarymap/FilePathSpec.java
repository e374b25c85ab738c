package org.silica.compiler.frontend.librarymap;

import org.silica.compiler.api.SourceLocation;

/**
 * A file path specification as written in a library map, quoted or bare.
 *
 * @param text     The raw text, including quotes if it was quoted.
 * @param location Where the specification starts.
 */
public record FilePathSpec(String text, SourceLocation location) {

    /**
     * @return The path pattern with surrounding quotes removed.
     */
    public String path() {
        if (text.startsWith("\"")) {
            if (text.length() < 3) {
                return "";
            }
            return text.endsWith("\"") ? text.substring(1, text.length() - 1) : text.substring(1);
        }
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
