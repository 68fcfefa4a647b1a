package org.begend.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code begin ... end} block.
 *
 * @param id The node identifier.
 * @param statements The statements of the block in source order.
 */
public record BlockNode(
        int id,
        List<StatementNode> statements
) implements StatementNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public String displayName() {
        return "Block";
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(statements);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BlockNode other
                && Objects.equals(statements, other.statements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statements);
    }
}
