package org.silica.compiler.diagnostics;

import org.silica.compiler.api.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * Instances are not thread-safe; every syntax tree owns its own engine so that
 * trees can be parsed concurrently.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a diagnostic.
     *
     * @param diagnostic The diagnostic to record.
     * @return The recorded diagnostic.
     */
    public Diagnostic report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    /**
     * Reports a diagnostic for the given code.
     *
     * @param code     The diagnostic code.
     * @param location The location the diagnostic refers to.
     * @param args     The message arguments.
     * @return The recorded diagnostic.
     */
    public Diagnostic report(DiagCode code, SourceLocation location, Object... args) {
        return report(Diagnostic.of(code, location, args));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Counts the diagnostics reported with the given code.
     *
     * @param code The code to count.
     * @return The number of matching diagnostics.
     */
    public long count(DiagCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
