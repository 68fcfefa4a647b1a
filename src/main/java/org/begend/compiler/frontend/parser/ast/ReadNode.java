package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code read(target);}
 */
public record ReadNode(
        int id,
        ExpressionNode target
) implements StatementNode {

    @Override
    public String displayName() {
        return "Read";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReadNode other
                && Objects.equals(target, other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target);
    }
}
