package org.begend.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Groups an ordered list of sibling nodes under one labelled node, e.g. {@code "Params"} or
 * {@code "Arguments"}.
 *
 * @param id The node identifier.
 * @param label The label shown for the group.
 * @param nodes The grouped nodes in source order.
 * @param <T> The type of the grouped nodes.
 */
public record NodeListNode<T extends AstNode>(
        int id,
        String label,
        List<T> nodes
) implements AstNode {

    public NodeListNode {
        nodes = List.copyOf(nodes);
    }

    @Override
    public String displayName() {
        return label;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeListNode<?> other
                && Objects.equals(label, other.label) && Objects.equals(nodes, other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, nodes);
    }
}
