package org.begend.compiler.frontend.parser;

import org.begend.compiler.frontend.lexer.Token;

/**
 * Thrown by the {@link Parser} at the first unmet expectation. The parse is abandoned; no
 * partial tree is returned.
 */
public class ParseError extends RuntimeException {

    private final Token lastToken;
    private final Token errorToken;

    /**
     * Constructs a new parse error.
     * @param message What the parser expected.
     * @param lastToken The last token consumed successfully before the failure.
     * @param errorToken The token at the failure site.
     */
    public ParseError(String message, Token lastToken, Token errorToken) {
        super(message);
        this.lastToken = lastToken;
        this.errorToken = errorToken;
    }

    public Token getLastToken() {
        return lastToken;
    }

    public Token getErrorToken() {
        return errorToken;
    }
}
