package org.snrasm.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during assembly or disassembly.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * Every compilation unit gets its own engine so units can be processed on
 * separate threads; the compiler merges them afterwards with {@link #mergeFrom}.
 */
public class DiagnosticsEngine {

    private final String fileName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates an engine for diagnostics of the given file.
     * @param fileName The file name attached to every reported diagnostic.
     */
    public DiagnosticsEngine(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param span    The primary span of the error.
     * @param labels  Optional secondary labels.
     */
    public void reportError(String message, Span span, Diagnostic.Label... labels) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, span, List.of(labels)));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param span    The primary span of the warning.
     * @param labels  Optional secondary labels.
     */
    public void reportWarning(String message, Span span, Diagnostic.Label... labels) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, span, List.of(labels)));
    }

    /**
     * Adds an already built diagnostic.
     * @param diagnostic The diagnostic.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Copies all diagnostics of another engine into this one, moving their spans.
     *
     * @param other The engine to copy from.
     * @param delta The offset added to every span.
     */
    public void mergeFrom(DiagnosticsEngine other, int delta) {
        for (Diagnostic d : other.diagnostics) {
            diagnostics.add(d.shift(delta));
        }
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
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Groups the collected diagnostics by severity, keeping report order inside each group.
     *
     * @return A map from type to the diagnostics of that type.
     */
    public Map<Diagnostic.Type, List<Diagnostic>> bySeverity() {
        Map<Diagnostic.Type, List<Diagnostic>> result = new EnumMap<>(Diagnostic.Type.class);
        for (Diagnostic d : diagnostics) {
            result.computeIfAbsent(d.type(), t -> new ArrayList<>()).add(d);
        }
        return result;
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
