package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An assignment {@code source -> target;}. The value is written on the left of the arrow and the
 * destination on the right.
 *
 * @param id The node identifier.
 * @param source The expression producing the value.
 * @param target The expression naming the destination.
 */
public record AssignmentNode(
        int id,
        ExpressionNode source,
        ExpressionNode target
) implements StatementNode {

    @Override
    public String displayName() {
        return "Assignment";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(source, target);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssignmentNode other
                && Objects.equals(source, other.source) && Objects.equals(target, other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }
}
