package org.zignet.compiler.api;

/**
 * An exception that is thrown when the source cannot be turned into a syntax tree.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * Lexical and syntax errors are reported through subclasses; both always carry the
 * position of the offending input.
 */
public class CompilationException extends Exception {

    private final String detail;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message and source information.
     * The resulting message has the form {@code "<message> at <line>:<column>"}.
     * @param message The detail message.
     * @param sourceInfo The source information.
     */
    public CompilationException(String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
        this.detail = message;
        this.sourceInfo = sourceInfo;
    }

    /**
     * Returns the message without the position suffix.
     * @return The detail message.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Returns the position of the error.
     * @return The source information.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
