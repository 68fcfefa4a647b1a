package org.begend.compiler.frontend.parser;

import org.begend.compiler.diagnostics.DiagnosticsEngine;
import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;
import org.begend.compiler.frontend.parser.ast.AstFactory;
import org.begend.compiler.frontend.parser.ast.BlockNode;
import org.begend.compiler.frontend.parser.ast.EnumNode;
import org.begend.compiler.frontend.parser.ast.EnumValueNode;
import org.begend.compiler.frontend.parser.ast.ExpressionNode;
import org.begend.compiler.frontend.parser.ast.ForNode;
import org.begend.compiler.frontend.parser.ast.FunctionNode;
import org.begend.compiler.frontend.parser.ast.IfNode;
import org.begend.compiler.frontend.parser.ast.NodeIdGenerator;
import org.begend.compiler.frontend.parser.ast.OrIfBranchNode;
import org.begend.compiler.frontend.parser.ast.ParamNode;
import org.begend.compiler.frontend.parser.ast.ProgramNode;
import org.begend.compiler.frontend.parser.ast.StatementNode;
import org.begend.compiler.frontend.parser.ast.VarDeclItemNode;
import org.begend.compiler.frontend.parser.ast.VarDeclNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The recursive-descent parser of the language. It consumes the list of tokens produced by the
 * {@link org.begend.compiler.frontend.lexer.Lexer} and builds a single {@link ProgramNode}.
 * <p>
 * Parsing is fail-fast: the first unmet expectation is reported to the diagnostics engine and
 * thrown as a {@link ParseError}. There is no resynchronization.
 * A parser instance parses its token list once and is not thread-safe.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final AstFactory factory;
    private final ExpressionParser expressions;
    private int current = 0;
    private Token lastConsumed;

    /**
     * Constructs a new Parser that numbers nodes starting at 1.
     * @param tokens The list of tokens to parse, terminated by an EOF token.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, new NodeIdGenerator());
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an EOF token.
     * @param diagnostics The engine for reporting errors.
     * @param ids The source of node identifiers.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, NodeIdGenerator ids) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with an EOF token.");
        }
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.factory = new AstFactory(ids);
        this.expressions = new ExpressionParser(this);
    }

    /**
     * Parses the entire token stream.
     * @return The program node.
     * @throws ParseError at the first syntax error.
     */
    public ProgramNode parse() {
        List<FunctionNode> functions = new ArrayList<>();
        List<EnumNode> enums = new ArrayList<>();
        List<StatementNode> statements = new ArrayList<>();

        while (!isAtEnd()) {
            if (check(TokenType.BEGIN) && checkNext(TokenType.FUNCTION)) {
                advance();
                advance();
                functions.add(function(true));
            } else if (match(TokenType.FUNCTION)) {
                functions.add(function(false));
            } else if (match(TokenType.ENUM)) {
                enums.add(enumDeclaration());
            } else {
                statements.add(statement());
            }
        }

        return factory.program(functions, enums, statements);
    }

    // 'function' (and a leading 'begin') have been consumed.
    private FunctionNode function(boolean openedWithBegin) {
        Token name = consume(TokenType.IDENT, "Expected function name");
        List<ParamNode> params = parameters();
        consume(TokenType.COLON, "Expected ':' after parameters");
        Token returnType = type();
        StatementNode body = statement();

        if (openedWithBegin) {
            // A block body already consumed its own 'end'.
            if (!(body instanceof BlockNode)) {
                consume(TokenType.END, "Expected 'end' after function body");
            }
            consume(TokenType.FUNCTION, "Expected 'function' after 'end'");
        } else if (match(TokenType.END)) {
            consume(TokenType.FUNCTION, "Expected 'function' after 'end'");
        }

        return factory.function(name, params, returnType, body);
    }

    private List<ParamNode> parameters() {
        List<ParamNode> params = new ArrayList<>();
        consume(TokenType.LPAREN, "Expected '(' after function name");
        if (match(TokenType.RPAREN)) {
            return params;
        }

        do {
            Token name = consume(TokenType.IDENT, "Expected parameter name");
            consume(TokenType.COLON, "Expected ':' after parameter name");
            params.add(factory.param(name, type()));
        } while (match(TokenType.COMMA));

        consume(TokenType.RPAREN, "Expected ')' after parameters");
        return params;
    }

    private Token type() {
        if (match(TokenType.INT, TokenType.REAL, TokenType.BOOL)) {
            return previous();
        }
        throw error("Expected type (int, real or bool)");
    }

    // 'enum' has been consumed.
    private EnumNode enumDeclaration() {
        Token name = consume(TokenType.IDENT, "Expected enum name");
        consume(TokenType.LBRACE, "Expected '{' after enum name");

        List<EnumValueNode> values = new ArrayList<>();
        if (!check(TokenType.RBRACE)) {
            do {
                values.add(factory.enumValue(consume(TokenType.IDENT, "Expected enum value")));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACE, "Expected '}' after enum values");

        // The terminator may be left out before another declaration or the end of input.
        if (!isAtEnd() && !check(TokenType.FUNCTION) && !check(TokenType.ENUM)
                && !check(TokenType.INT) && !check(TokenType.REAL) && !check(TokenType.BOOL)) {
            consume(TokenType.SEMICOLON, "Expected ';' after enum declaration");
        }

        return factory.enumDeclaration(name, values);
    }

    /**
     * Parses a single statement.
     * @return The parsed statement.
     * @throws ParseError if no statement starts at the current token.
     */
    public StatementNode statement() {
        if (check(TokenType.BEGIN)) {
            advance();
            if (match(TokenType.IF)) return ifStatement();
            if (match(TokenType.FOR)) return forStatement();
            return block();
        }
        if (match(TokenType.INT, TokenType.REAL, TokenType.BOOL)) {
            return varDeclaration(previous());
        }
        if (match(TokenType.PRINT)) {
            ExpressionNode expression = parenthesized("print");
            consume(TokenType.SEMICOLON, "Expected ';' after 'print' statement");
            return factory.print(expression);
        }
        if (match(TokenType.READ)) {
            ExpressionNode target = parenthesized("read");
            consume(TokenType.SEMICOLON, "Expected ';' after 'read' statement");
            return factory.read(target);
        }
        if (match(TokenType.RETURN)) {
            return returnStatement();
        }
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();

        ExpressionNode expression = expressions.parseExpression();
        if (match(TokenType.ASSIGN_ARROW)) {
            ExpressionNode target = expressions.parseExpression();
            consume(TokenType.SEMICOLON, "Expected ';' after assignment");
            return factory.assignment(expression, target);
        }
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return factory.expressionStatement(expression);
    }

    private VarDeclNode varDeclaration(Token type) {
        List<ExpressionNode> dimensions = new ArrayList<>();
        while (match(TokenType.LBRACKET)) {
            Token size = consume(TokenType.INT_LITERAL, "Expected integer literal as array dimension");
            dimensions.add(factory.literal(size));
            consume(TokenType.RBRACKET, "Expected ']' after array dimension");
        }

        List<VarDeclItemNode> variables = new ArrayList<>();
        do {
            variables.add(factory.varDeclItem(consume(TokenType.IDENT, "Expected variable name")));
        } while (match(TokenType.COMMA));

        consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
        return factory.varDecl(type, dimensions, variables);
    }

    private ExpressionNode parenthesized(String keyword) {
        consume(TokenType.LPAREN, "Expected '(' after '" + keyword + "'");
        ExpressionNode expression = expressions.parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after expression");
        return expression;
    }

    // 'return' has been consumed.
    private StatementNode returnStatement() {
        ExpressionNode expression = null;
        if (!isAtEnd() && !check(TokenType.SEMICOLON) && !check(TokenType.END)
                && !check(TokenType.ELSE) && !check(TokenType.OR)) {
            expression = expressions.parseExpression();
        }
        // The last statement of a block may omit the ';' before 'end'.
        if (!isAtEnd() && !check(TokenType.END)) {
            consume(TokenType.SEMICOLON, "Expected ';' after 'return' statement");
        }
        return factory.returnStatement(expression);
    }

    // 'if' (and possibly 'begin') has been consumed.
    private IfNode ifStatement() {
        consume(TokenType.LPAREN, "Expected '(' after 'if'");
        ExpressionNode condition = expressions.parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after condition");
        StatementNode thenBranch = statement();

        List<OrIfBranchNode> orIfBranches = new ArrayList<>();
        while (match(TokenType.OR)) {
            consume(TokenType.IF, "Expected 'if' after 'or'");
            consume(TokenType.LPAREN, "Expected '(' after 'if'");
            ExpressionNode orCondition = expressions.parseExpression();
            consume(TokenType.RPAREN, "Expected ')' after condition");
            orIfBranches.add(factory.orIfBranch(orCondition, statement()));
        }

        StatementNode elseBranch = match(TokenType.ELSE) ? statement() : null;

        // A bare 'end' may close the statement.
        match(TokenType.END);

        return factory.ifStatement(condition, thenBranch, orIfBranches, elseBranch);
    }

    // 'for' (and possibly 'begin') has been consumed.
    private ForNode forStatement() {
        consume(TokenType.LPAREN, "Expected '(' after 'for'");
        Token variable = consume(TokenType.IDENT, "Expected loop variable");
        consume(TokenType.GOES, "Expected 'goes'");
        consume(TokenType.FROM, "Expected 'from'");
        ExpressionNode from = expressions.parseExpression();
        consume(TokenType.TO, "Expected 'to'");
        ExpressionNode to = expressions.parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after loop range");

        StatementNode body = statement();

        if (match(TokenType.END)) {
            consume(TokenType.FOR, "Expected 'for' after 'end'");
        }

        return factory.forLoop(variable, from, to, body);
    }

    // 'begin' has been consumed.
    private BlockNode block() {
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.END) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.END, "Expected 'end'");
        return factory.block(statements);
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) {
            lastConsumed = peek();
            current++;
        }
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(errorMessage);
    }

    @Override
    public ParseError error(String message) {
        Token errorToken = isAtEnd() && current > 0 ? previous() : peek();
        Token lastToken = lastConsumed != null ? lastConsumed : tokens.get(0);
        diagnostics.reportError(message, errorToken.fileName(), errorToken.line(), errorToken.column());
        return new ParseError(message, lastToken, errorToken);
    }

    @Override
    public AstFactory getFactory() {
        return factory;
    }
}
