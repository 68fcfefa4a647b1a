package org.begend.compiler.api;

import org.begend.compiler.frontend.lexer.Token;

/**
 * Thrown when a source unit is lexically valid but does not match the grammar.
 * Carries enough context to render a precise diagnostic without re-scanning the input.
 */
public class SyntaxException extends CompilationException {

    private final String reason;
    private final Token lastToken;
    private final Token errorToken;

    /**
     * Constructs a new syntax exception.
     * @param reason What the parser expected.
     * @param lastToken The last token consumed successfully.
     * @param errorToken The token at the failure site.
     * @param sourceInfo The position of the error token.
     * @param cause The parser's error.
     */
    public SyntaxException(String reason, Token lastToken, Token errorToken, SourceInfo sourceInfo, Throwable cause) {
        super(reason, sourceInfo, cause);
        this.reason = reason;
        this.lastToken = lastToken;
        this.errorToken = errorToken;
    }

    /**
     * Returns the parser's message without position information.
     * @return The reason of the failure.
     */
    public String getReason() {
        return reason;
    }

    public Token getLastToken() {
        return lastToken;
    }

    public Token getErrorToken() {
        return errorToken;
    }
}
