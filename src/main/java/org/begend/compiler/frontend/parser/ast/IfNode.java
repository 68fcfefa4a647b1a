package org.begend.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A conditional statement with any number of {@code or if} branches and an optional
 * {@code else} branch.
 *
 * @param id The node identifier.
 * @param condition The condition of the first branch.
 * @param thenBranch The statement executed when the condition holds.
 * @param orIfBranches The {@code or if} branches in source order.
 * @param elseBranch The {@code else} statement, or null if there is none.
 */
public record IfNode(
        int id,
        ExpressionNode condition,
        StatementNode thenBranch,
        List<OrIfBranchNode> orIfBranches,
        StatementNode elseBranch
) implements StatementNode {

    public IfNode {
        orIfBranches = List.copyOf(orIfBranches);
    }

    @Override
    public String displayName() {
        return "If";
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBranch);
        children.addAll(orIfBranches);
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IfNode other
                && Objects.equals(condition, other.condition)
                && Objects.equals(thenBranch, other.thenBranch)
                && Objects.equals(orIfBranches, other.orIfBranches)
                && Objects.equals(elseBranch, other.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, thenBranch, orIfBranches, elseBranch);
    }
}
