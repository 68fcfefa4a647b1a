package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An enum declaration, e.g. {@code enum Color { RED, GREEN }}.
 *
 * @param id The node identifier.
 * @param enumName The terminal holding the enum's name.
 * @param values The declared values, grouped under {@code "Values"}.
 */
public record EnumNode(
        int id,
        TerminalNode enumName,
        NodeListNode<EnumValueNode> values
) implements AstNode {

    @Override
    public String displayName() {
        return "Enum";
    }

    public String name() {
        return enumName.text();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(enumName, values);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnumNode other
                && Objects.equals(enumName, other.enumName) && Objects.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enumName, values);
    }
}
