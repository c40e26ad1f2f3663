package org.zignet.compiler.backend.emit;

/**
 * Accumulates generated source line by line with a current indentation level.
 */
final class SourceWriter {

    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int level = 0;

    SourceWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    void line(String text) {
        out.append(indentUnit.repeat(level)).append(text).append('\n');
    }

    void blankLine() {
        out.append('\n');
    }

    void indent() {
        level++;
    }

    void dedent() {
        if (level == 0) {
            throw new IllegalStateException("Unbalanced dedent");
        }
        level--;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
