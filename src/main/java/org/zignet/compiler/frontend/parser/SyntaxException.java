package org.zignet.compiler.frontend.parser;

import org.zignet.compiler.api.CompilationException;
import org.zignet.compiler.api.SourceInfo;
import org.zignet.compiler.frontend.lexer.Token;

/**
 * Thrown by the {@link Parser} at the first token that does not fit the grammar.
 * Parsing stops there; there is no recovery, so a parse attempt yields at most one of these.
 */
public class SyntaxException extends CompilationException {

    private final transient Token token;

    /**
     * @param message What the parser expected.
     * @param token The offending token.
     */
    public SyntaxException(String message, Token token) {
        super(message + ", found " + token.describe(), new SourceInfo(token.line(), token.column()));
        this.token = token;
    }

    /**
     * @return The token at which parsing stopped.
     */
    public Token getToken() {
        return token;
    }
}
