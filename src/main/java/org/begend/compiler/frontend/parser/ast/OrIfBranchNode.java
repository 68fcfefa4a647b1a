package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An {@code or if (condition) body} branch of an {@link IfNode}.
 *
 * @param id The node identifier.
 * @param condition The branch condition.
 * @param body The statement executed when the condition holds.
 */
public record OrIfBranchNode(
        int id,
        ExpressionNode condition,
        StatementNode body
) implements AstNode {

    @Override
    public String displayName() {
        return "OrIf";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OrIfBranchNode other
                && Objects.equals(condition, other.condition) && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, body);
    }
}
