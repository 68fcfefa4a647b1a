package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An expression evaluated for its effect, e.g. a call {@code log(x);}.
 */
public record ExpressionStatementNode(
        int id,
        ExpressionNode expression
) implements StatementNode {

    @Override
    public String displayName() {
        return "ExpressionStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpressionStatementNode other
                && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }
}
