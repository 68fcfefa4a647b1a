package org.begend.compiler.frontend.parser;

import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;
import org.begend.compiler.frontend.parser.ast.AstFactory;

/**
 * An interface that encapsulates the cursor over the token stream during parsing.
 * It gives sub-parsers such as the {@link ExpressionParser} access to the tokens and the node
 * factory without coupling them to the statement parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * Always false at the end of the stream.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage The message of the error raised if the token type does not match.
     * @return The consumed token.
     * @throws ParseError if the current token is not of the expected type.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Reports an error at the current position and returns the exception to throw.
     * @param message The error message.
     * @return The error, carrying the last consumed token and the token at the failure site.
     */
    ParseError error(String message);

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if the current token is EOF, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Gets the factory used to build and number nodes for this parse.
     * @return The node factory.
     */
    AstFactory getFactory();
}
