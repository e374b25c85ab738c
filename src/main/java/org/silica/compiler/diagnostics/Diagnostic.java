package org.silica.compiler.diagnostics;

import org.silica.compiler.api.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a single diagnostic message (error, warning, note)
 * that occurs during the compilation process.
 *
 * @param type       The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code       The code identifying the diagnostic, or {@code null} for free-form messages.
 * @param message    The diagnostic message.
 * @param fileName   The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 * @param notes      Secondary diagnostics that point at related locations.
 */
public record Diagnostic(
        Type type,
        DiagCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber,
        List<Diagnostic> notes
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that makes the result unusable. */
        ERROR,
        /** A warning that does not affect the result. */
        WARNING,
        /** Additional information attached to another diagnostic. */
        NOTE
    }

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Creates a diagnostic for the given code with its default severity.
     * @param code The diagnostic code.
     * @param location The location the diagnostic refers to.
     * @param args The message arguments.
     * @return The new diagnostic.
     */
    public static Diagnostic of(DiagCode code, SourceLocation location, Object... args) {
        return new Diagnostic(code.severity(), code, code.format(args),
                location.fileName(), location.lineNumber(), location.columnNumber(), List.of());
    }

    /**
     * Returns a copy of this diagnostic with an additional note attached.
     * @param code The note code.
     * @param location The location the note points at.
     * @param args The message arguments.
     * @return The new diagnostic.
     */
    public Diagnostic withNote(DiagCode code, SourceLocation location, Object... args) {
        List<Diagnostic> extended = new ArrayList<>(notes);
        extended.add(of(code, location, args));
        return new Diagnostic(type, this.code, message, fileName, lineNumber, columnNumber, extended);
    }

    /**
     * @return The location of this diagnostic.
     */
    public SourceLocation location() {
        return new SourceLocation(fileName, lineNumber, columnNumber);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message));
        for (Diagnostic note : notes) {
            sb.append("\n  ").append(note);
        }
        return sb.toString();
    }
}
