package org.zignet.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting the diagnostic messages of one semantic analysis run.
 * <p>
 * This decouples error reporting from the actual checker logic.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param line    The line number of the error.
     * @param column  The column number of the error.
     */
    public void reportError(String message, int line, int column) {
        diagnostics.add(Diagnostic.error(message, line, column));
    }

    /**
     * Returns an unmodifiable snapshot of all collected diagnostics, in reporting order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    /**
     * Removes all collected diagnostics.
     */
    public void clear() {
        diagnostics.clear();
    }
}
