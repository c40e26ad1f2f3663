package org.zignet.compiler.diagnostics;

import org.zignet.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param sourceInfo The position of the issue, or {@code null} if it cannot be determined.
 */
public record Diagnostic(
        Type type,
        String message,
        SourceInfo sourceInfo
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that blocks the program. */
        ERROR,
        /** An advisory finding. */
        WARNING
    }

    /**
     * Creates an error diagnostic at the given position.
     * @param message The diagnostic message.
     * @param line The line number.
     * @param column The column number.
     * @return The new diagnostic.
     */
    public static Diagnostic error(String message, int line, int column) {
        return new Diagnostic(Type.ERROR, message, new SourceInfo(line, column));
    }

    /**
     * Checks whether the diagnostic carries a source position.
     * @return {@code true} if a position is present.
     */
    public boolean hasPosition() {
        return sourceInfo != null;
    }

    @Override
    public String toString() {
        if (sourceInfo == null) {
            return String.format("[%s] %s", type, message);
        }
        return String.format("[%s] %s: %s", type, sourceInfo, message);
    }
}
