package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * One variable name of a {@link VarDeclNode}.
 *
 * @param id The node identifier.
 * @param varName The terminal holding the variable name.
 */
public record VarDeclItemNode(
        int id,
        TerminalNode varName
) implements AstNode {

    @Override
    public String displayName() {
        return "VarDeclItem";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(varName);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VarDeclItemNode other
                && Objects.equals(varName, other.varName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(varName);
    }
}
