package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A reference to a scalar variable ({@code x}) or an array element ({@code grid[i][j]}).
 *
 * @param id The node identifier.
 * @param varName The terminal holding the variable name.
 * @param indices The index expressions grouped under {@code "Indices"}, or null for a scalar reference.
 */
public record VariableNode(
        int id,
        TerminalNode varName,
        NodeListNode<ExpressionNode> indices
) implements ExpressionNode {

    public String name() {
        return varName.text();
    }

    public boolean isArrayAccess() {
        return indices != null;
    }

    /**
     * Returns the index expressions in source order.
     * @return The indices, empty for a scalar reference.
     */
    public List<ExpressionNode> indexExpressions() {
        return indices != null ? indices.nodes() : List.of();
    }

    @Override
    public String displayName() {
        return "Variable";
    }

    @Override
    public List<AstNode> getChildren() {
        return indices != null ? List.of(varName, indices) : List.of(varName);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableNode other
                && Objects.equals(varName, other.varName) && Objects.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(varName, indices);
    }
}
