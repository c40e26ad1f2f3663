package org.zignet.compiler.api;

import org.zignet.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of {@link ICompiler#analyze(String)}.
 *
 * @param success {@code true} if no error was found.
 * @param errors The errors in reporting order.
 * @param warnings The warnings in reporting order.
 * @param summary A short human-readable verdict.
 */
public record AnalysisResult(boolean success, List<Diagnostic> errors, List<Diagnostic> warnings, String summary) {

    public AnalysisResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
