package org.zignet.compiler.api;

import org.zignet.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of {@link ICompiler#format(String)}.
 *
 * @param success {@code true} if the source was formatted.
 * @param output The formatted source, or {@code null} on failure.
 * @param errors The reason for a failure; empty on success.
 * @param summary A short human-readable verdict.
 */
public record FormatResult(boolean success, String output, List<Diagnostic> errors, String summary) {

    public FormatResult {
        errors = List.copyOf(errors);
    }
}
