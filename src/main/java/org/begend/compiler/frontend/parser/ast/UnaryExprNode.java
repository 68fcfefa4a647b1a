package org.begend.compiler.frontend.parser.ast;

import org.begend.compiler.frontend.lexer.TokenType;

import java.util.List;
import java.util.Objects;

/**
 * A prefix operation, {@code -x} or {@code not x}.
 *
 * @param id The node identifier.
 * @param operator The terminal holding the operator token.
 * @param operand The operand.
 */
public record UnaryExprNode(
        int id,
        TerminalNode operator,
        ExpressionNode operand
) implements ExpressionNode {

    public TokenType operatorType() {
        return operator.token().type();
    }

    @Override
    public String displayName() {
        return "UnaryExpr";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operator, operand);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnaryExprNode other
                && Objects.equals(operator, other.operator) && Objects.equals(operand, other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }
}
