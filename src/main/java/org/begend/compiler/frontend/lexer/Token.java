package org.begend.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, operator).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of a literal token (Integer, Double or Boolean), otherwise null.
 * @param line The 1-based line number where the token begins.
 * @param column The 1-based column number where the token begins.
 * @param fileName The logical file name of the source the token was read from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Formats the token the way diagnostics print it, e.g. {@code IDENT 'x' @3:7}.
     * @return The type, lexeme and position of this token.
     */
    public String describe() {
        return String.format("%s '%s' @%d:%d", type, text, line, column);
    }
}
