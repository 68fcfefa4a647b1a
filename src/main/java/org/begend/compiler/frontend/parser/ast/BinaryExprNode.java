package org.begend.compiler.frontend.parser.ast;

import org.begend.compiler.frontend.lexer.TokenType;

import java.util.List;
import java.util.Objects;

/**
 * A binary operation. All binary operators are left-associative, so {@code a - b - c} nests in
 * the left operand.
 *
 * @param id The node identifier.
 * @param left The left operand.
 * @param operator The terminal holding the operator token.
 * @param right The right operand.
 */
public record BinaryExprNode(
        int id,
        ExpressionNode left,
        TerminalNode operator,
        ExpressionNode right
) implements ExpressionNode {

    public TokenType operatorType() {
        return operator.token().type();
    }

    @Override
    public String displayName() {
        return "BinaryExpr";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, operator, right);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BinaryExprNode other
                && Objects.equals(left, other.left)
                && Objects.equals(operator, other.operator)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
