package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A return statement.
 *
 * @param id The node identifier.
 * @param expression The returned value, or null for a bare {@code return}.
 */
public record ReturnNode(
        int id,
        ExpressionNode expression
) implements StatementNode {

    @Override
    public String displayName() {
        return "Return";
    }

    @Override
    public List<AstNode> getChildren() {
        return expression != null ? List.of(expression) : List.of();
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReturnNode other
                && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }
}
