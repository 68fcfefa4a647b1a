package org.begend.compiler.frontend.parser;

import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;
import org.begend.compiler.frontend.parser.ast.AstFactory;
import org.begend.compiler.frontend.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses expressions by precedence climbing. Each level parses the next tighter level and loops
 * while one of its own operators follows, which makes every binary operator left-associative.
 * <p>
 * From loosest to tightest: {@code or}, {@code and}, {@code = !=}, {@code < <= > >=},
 * {@code + -}, {@code * / %}, unary {@code - not}, primary.
 */
public class ExpressionParser {

    private final ParsingContext context;
    private final AstFactory factory;

    /**
     * Creates an expression parser working on the given cursor.
     * @param context The token cursor shared with the statement parser.
     */
    public ExpressionParser(ParsingContext context) {
        this.context = context;
        this.factory = context.getFactory();
    }

    /**
     * Parses a full expression starting at the current token.
     * @return The expression node.
     * @throws ParseError if no expression starts at the current token.
     */
    public ExpressionNode parseExpression() {
        return parseLogicalOr();
    }

    private ExpressionNode parseLogicalOr() {
        ExpressionNode expr = parseLogicalAnd();
        while (context.match(TokenType.OR)) {
            Token op = context.previous();
            expr = factory.binary(expr, op, parseLogicalAnd());
        }
        return expr;
    }

    private ExpressionNode parseLogicalAnd() {
        ExpressionNode expr = parseEquality();
        while (context.match(TokenType.AND)) {
            Token op = context.previous();
            expr = factory.binary(expr, op, parseEquality());
        }
        return expr;
    }

    private ExpressionNode parseEquality() {
        ExpressionNode expr = parseRelational();
        while (context.match(TokenType.EQ, TokenType.NE)) {
            Token op = context.previous();
            expr = factory.binary(expr, op, parseRelational());
        }
        return expr;
    }

    private ExpressionNode parseRelational() {
        ExpressionNode expr = parseAdditive();
        while (context.match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE)) {
            Token op = context.previous();
            expr = factory.binary(expr, op, parseAdditive());
        }
        return expr;
    }

    private ExpressionNode parseAdditive() {
        ExpressionNode expr = parseMultiplicative();
        while (context.match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = context.previous();
            expr = factory.binary(expr, op, parseMultiplicative());
        }
        return expr;
    }

    private ExpressionNode parseMultiplicative() {
        ExpressionNode expr = parseUnary();
        while (context.match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = context.previous();
            expr = factory.binary(expr, op, parseUnary());
        }
        return expr;
    }

    private ExpressionNode parseUnary() {
        if (context.match(TokenType.MINUS, TokenType.NOT)) {
            Token op = context.previous();
            return factory.unary(op, parseUnary());
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        if (context.match(TokenType.INT_LITERAL, TokenType.REAL_LITERAL, TokenType.BOOL_LITERAL)) {
            return factory.literal(context.previous());
        }

        if (context.match(TokenType.IDENT)) {
            Token name = context.previous();

            if (context.match(TokenType.LPAREN)) {
                List<ExpressionNode> arguments = new ArrayList<>();
                if (!context.check(TokenType.RPAREN)) {
                    do {
                        arguments.add(parseExpression());
                    } while (context.match(TokenType.COMMA));
                }
                context.consume(TokenType.RPAREN, "Expected ')' after arguments");
                return factory.call(name, arguments);
            }

            List<ExpressionNode> indices = new ArrayList<>();
            while (context.match(TokenType.LBRACKET)) {
                indices.add(parseExpression());
                context.consume(TokenType.RBRACKET, "Expected ']' after index");
            }
            return factory.variable(name, indices);
        }

        if (context.match(TokenType.LPAREN)) {
            ExpressionNode expr = parseExpression();
            context.consume(TokenType.RPAREN, "Expected ')' after expression");
            return expr;
        }

        throw context.error("Expected expression");
    }
}
