package org.begend.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    BEGIN, END, FUNCTION, RETURN,
    IF, OR, ELSE,
    FOR, GOES, FROM, TO,
    PRINT, READ, ENUM,
    AND, NOT,

    // Type keywords.
    /** The {@code int} type marker. */
    INT,
    /** The {@code real} type marker. */
    REAL,
    /** The {@code bool} type marker. */
    BOOL,

    // Literals.
    /** An identifier, such as a variable, function or enum name. */
    IDENT,
    /** An integer literal such as {@code 42}. */
    INT_LITERAL,
    /** A decimal literal such as {@code 2.5}. */
    REAL_LITERAL,
    /** {@code true} or {@code false}. */
    BOOL_LITERAL,

    // Operators.
    PLUS, MINUS, STAR, SLASH, PERCENT,
    /** The assignment arrow {@code ->}. */
    ASSIGN_ARROW,
    /** Equality {@code =}. */
    EQ,
    /** Inequality {@code !=}. */
    NE,
    LT, LE, GT, GE,

    // Punctuation.
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    COMMA, COLON, SEMICOLON,

    /** Represents the end of the source. */
    EOF
}
