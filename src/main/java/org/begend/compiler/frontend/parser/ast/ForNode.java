package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A counting loop, {@code for (i goes from a to b) body}.
 *
 * @param id The node identifier.
 * @param varName The terminal holding the loop variable.
 * @param from The start expression.
 * @param to The end expression.
 * @param body The loop body.
 */
public record ForNode(
        int id,
        TerminalNode varName,
        ExpressionNode from,
        ExpressionNode to,
        StatementNode body
) implements StatementNode {

    @Override
    public String displayName() {
        return "For";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(varName, from, to, body);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ForNode other
                && Objects.equals(varName, other.varName)
                && Objects.equals(from, other.from)
                && Objects.equals(to, other.to)
                && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(varName, from, to, body);
    }
}
