package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function parameter, {@code name: type}.
 *
 * @param id The node identifier.
 * @param paramName The terminal holding the parameter name.
 * @param paramType The terminal holding the type marker.
 */
public record ParamNode(
        int id,
        TerminalNode paramName,
        TerminalNode paramType
) implements AstNode {

    @Override
    public String displayName() {
        return "Param";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(paramName, paramType);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParamNode other
                && Objects.equals(paramName, other.paramName) && Objects.equals(paramType, other.paramType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(paramName, paramType);
    }
}
