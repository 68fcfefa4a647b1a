package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code print(expression);}
 */
public record PrintNode(
        int id,
        ExpressionNode expression
) implements StatementNode {

    @Override
    public String displayName() {
        return "Print";
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
        return o instanceof PrintNode other
                && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }
}
