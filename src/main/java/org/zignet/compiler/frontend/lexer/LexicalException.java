package org.zignet.compiler.frontend.lexer;

import org.zignet.compiler.api.CompilationException;
import org.zignet.compiler.api.SourceInfo;

/**
 * Thrown by the {@link Lexer} for the first character sequence it cannot tokenize.
 */
public class LexicalException extends CompilationException {

    /**
     * @param message What went wrong.
     * @param line The line of the offending character.
     * @param column The column of the offending character.
     */
    public LexicalException(String message, int line, int column) {
        super(message, new SourceInfo(line, column));
    }
}
