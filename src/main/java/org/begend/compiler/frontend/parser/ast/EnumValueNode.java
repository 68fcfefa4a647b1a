package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A single value of an enum declaration.
 *
 * @param id The node identifier.
 * @param valueName The terminal holding the value's name.
 */
public record EnumValueNode(
        int id,
        TerminalNode valueName
) implements AstNode {

    @Override
    public String displayName() {
        return "EnumValue";
    }

    public String name() {
        return valueName.text();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(valueName);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnumValueNode other
                && Objects.equals(valueName, other.valueName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valueName);
    }
}
