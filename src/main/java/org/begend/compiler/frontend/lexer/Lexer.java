package org.begend.compiler.frontend.lexer;

import org.begend.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine} and scanning continues, so a single
 * pass collects every lexical error of the source. The returned list always ends with
 * exactly one {@link TokenType#EOF} token.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("begin", TokenType.BEGIN),
            Map.entry("end", TokenType.END),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("return", TokenType.RETURN),
            Map.entry("if", TokenType.IF),
            Map.entry("or", TokenType.OR),
            Map.entry("else", TokenType.ELSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("goes", TokenType.GOES),
            Map.entry("from", TokenType.FROM),
            Map.entry("to", TokenType.TO),
            Map.entry("print", TokenType.PRINT),
            Map.entry("read", TokenType.READ),
            Map.entry("enum", TokenType.ENUM),
            Map.entry("and", TokenType.AND),
            Map.entry("not", TokenType.NOT),
            Map.entry("int", TokenType.INT),
            Map.entry("real", TokenType.REAL),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL)
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by an EOF token.
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) break;
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> {
                if (peek() == '>') {
                    advance();
                    addToken(TokenType.ASSIGN_ARROW);
                } else {
                    addToken(TokenType.MINUS);
                }
            }
            case '*' -> addToken(TokenType.STAR);
            case '/' -> addToken(TokenType.SLASH);
            case '%' -> addToken(TokenType.PERCENT);
            case '=' -> addToken(TokenType.EQ);
            case '(' -> addToken(TokenType.LPAREN);
            case ')' -> addToken(TokenType.RPAREN);
            case '[' -> addToken(TokenType.LBRACKET);
            case ']' -> addToken(TokenType.RBRACKET);
            case '{' -> addToken(TokenType.LBRACE);
            case '}' -> addToken(TokenType.RBRACE);
            case ',' -> addToken(TokenType.COMMA);
            case ':' -> addToken(TokenType.COLON);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '<' -> addToken(match('=') ? TokenType.LE : TokenType.LT);
            case '>' -> addToken(match('=') ? TokenType.GE : TokenType.GT);
            case '!' -> {
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    reportError("Unexpected character: !");
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    reportError("Unexpected character: " + c);
                }
            }
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                // A line comment goes until the end of the line.
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                int commentLine = line;
                int commentColumn = column;
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) advance();
                if (isAtEnd()) {
                    // The comment swallows the rest of the input.
                    diagnostics.reportWarning("Unterminated block comment", logicalFileName, commentLine, commentColumn);
                } else {
                    advance();
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENT);
        if (type == TokenType.BOOL_LITERAL) {
            addToken(type, Boolean.parseBoolean(text));
        } else {
            addToken(type);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        if (peek() == '.') {
            advance(); // consume the '.'
            if (!isDigit(peek())) {
                reportError("Expected digit after '.' in number: " + source.substring(start, current));
                return;
            }
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            addToken(TokenType.REAL_LITERAL, Double.parseDouble(text));
            return;
        }

        String numberString = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Integer.parseInt(numberString));
        } catch (NumberFormatException e) {
            reportError("Invalid number format: " + numberString);
        }
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, logicalFileName));
    }

    private void reportError(String message) {
        diagnostics.reportError(message, logicalFileName, startLine, startColumn);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
