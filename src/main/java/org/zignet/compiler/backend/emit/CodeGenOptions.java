package org.zignet.compiler.backend.emit;

import com.typesafe.config.Config;

/**
 * Layout options for the {@link CodeGenerator}.
 *
 * @param indentSize The number of spaces per indentation level. Ignored when {@code useTabs} is set.
 * @param useTabs Whether to indent with one tab per level.
 * @param newlineBeforeBrace Whether the opening brace of a function body goes on its own line.
 */
public record CodeGenOptions(int indentSize, boolean useTabs, boolean newlineBeforeBrace) {

    private static final String INDENT_SIZE_KEY = "indent-size";
    private static final String USE_TABS_KEY = "use-tabs";
    private static final String NEWLINE_BEFORE_BRACE_KEY = "newline-before-brace";

    public CodeGenOptions {
        if (indentSize < 0) {
            throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
        }
    }

    /**
     * @return Four spaces per level, braces on the header line.
     */
    public static CodeGenOptions defaults() {
        return new CodeGenOptions(4, false, false);
    }

    /**
     * Reads the options from a {@code zignet.format}-style block. Missing keys keep their defaults.
     *
     * @param formatConfig The configuration block, e.g. {@code config.getConfig("zignet.format")}.
     * @return The options.
     */
    public static CodeGenOptions fromConfig(Config formatConfig) {
        CodeGenOptions defaults = defaults();
        int indentSize = formatConfig.hasPath(INDENT_SIZE_KEY)
                ? formatConfig.getInt(INDENT_SIZE_KEY) : defaults.indentSize();
        boolean useTabs = formatConfig.hasPath(USE_TABS_KEY)
                ? formatConfig.getBoolean(USE_TABS_KEY) : defaults.useTabs();
        boolean newlineBeforeBrace = formatConfig.hasPath(NEWLINE_BEFORE_BRACE_KEY)
                ? formatConfig.getBoolean(NEWLINE_BEFORE_BRACE_KEY) : defaults.newlineBeforeBrace();
        return new CodeGenOptions(indentSize, useTabs, newlineBeforeBrace);
    }

    public CodeGenOptions withIndentSize(int size) {
        return new CodeGenOptions(size, useTabs, newlineBeforeBrace);
    }

    public CodeGenOptions withUseTabs(boolean tabs) {
        return new CodeGenOptions(indentSize, tabs, newlineBeforeBrace);
    }

    /**
     * @return The text of one indentation level.
     */
    public String indentUnit() {
        return useTabs ? "\t" : " ".repeat(indentSize);
    }
}
