package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A variable declaration, e.g. {@code int[3][4] grid, other;}.
 *
 * @param id The node identifier.
 * @param type The terminal holding the element type marker.
 * @param dimensions The array dimensions (integer literals), grouped under {@code "Dimensions"}.
 * @param variables The declared names, grouped under {@code "Variables"}.
 */
public record VarDeclNode(
        int id,
        TerminalNode type,
        NodeListNode<ExpressionNode> dimensions,
        NodeListNode<VarDeclItemNode> variables
) implements StatementNode {

    @Override
    public String displayName() {
        return "VarDecl";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(type, dimensions, variables);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VarDeclNode other
                && Objects.equals(type, other.type)
                && Objects.equals(dimensions, other.dimensions)
                && Objects.equals(variables, other.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, dimensions, variables);
    }
}
