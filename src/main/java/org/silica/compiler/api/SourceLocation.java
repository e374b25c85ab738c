package org.silica.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName     The file where the code is located.
 * @param lineNumber   The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceLocation(String fileName, int lineNumber, int columnNumber) {

    /** Location used for synthesized constructs that have no source text. */
    public static final SourceLocation NONE = new SourceLocation("<none>", 0, 0);

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
