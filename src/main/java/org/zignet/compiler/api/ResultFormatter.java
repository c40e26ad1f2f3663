package org.zignet.compiler.api;

import org.zignet.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Renders results of the {@link ICompiler} as plain text reports.
 */
public final class ResultFormatter {

    private ResultFormatter() {}

    /**
     * Renders the summary followed by numbered errors and warnings.
     * @param result The analysis result.
     * @return The report without a trailing newline.
     */
    public static String render(AnalysisResult result) {
        StringBuilder out = new StringBuilder(result.summary()).append("\n\n");
        appendSection(out, "Errors", result.errors());
        appendSection(out, "Warnings", result.warnings());
        return out.toString().trim();
    }

    /**
     * Renders the summary followed by the formatted code, or by the numbered errors on failure.
     * @param result The formatting result.
     * @return The report without a trailing newline.
     */
    public static String render(FormatResult result) {
        StringBuilder out = new StringBuilder(result.summary()).append("\n\n");
        if (result.success()) {
            out.append(result.output());
        } else {
            appendSection(out, "Errors", result.errors());
        }
        return out.toString().trim();
    }

    /**
     * Renders one diagnostic as {@code "message (line L, col C)"}.
     * @param diagnostic The diagnostic.
     * @return The rendered line.
     */
    public static String describe(Diagnostic diagnostic) {
        if (!diagnostic.hasPosition()) {
            return diagnostic.message();
        }
        SourceInfo position = diagnostic.sourceInfo();
        return String.format("%s (line %d, col %d)", diagnostic.message(), position.lineNumber(), position.columnNumber());
    }

    private static void appendSection(StringBuilder out, String title, List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        out.append(title).append(":\n");
        for (int i = 0; i < diagnostics.size(); i++) {
            out.append(i + 1).append(". ").append(describe(diagnostics.get(i))).append('\n');
        }
        out.append('\n');
    }
}
