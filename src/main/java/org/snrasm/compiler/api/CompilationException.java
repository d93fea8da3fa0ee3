package org.snrasm.compiler.api;

import org.snrasm.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a source file cannot be assembled without errors.
 * <p>
 * It is part of the public API; the diagnostics that caused it are kept so callers can
 * render them.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of());
    }

    /**
     * Constructs a new compilation exception carrying the diagnostics of a failed run.
     * @param message     The detail message, usually the diagnostics summary.
     * @param diagnostics The diagnostics of the run.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
