package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function call {@code name(arg, ...)}.
 *
 * @param id The node identifier.
 * @param functionName The terminal holding the called name.
 * @param arguments The arguments grouped under {@code "Arguments"}, or null when called without arguments.
 */
public record CallNode(
        int id,
        TerminalNode functionName,
        NodeListNode<ExpressionNode> arguments
) implements ExpressionNode {

    public String name() {
        return functionName.text();
    }

    public List<ExpressionNode> argumentExpressions() {
        return arguments != null ? arguments.nodes() : List.of();
    }

    @Override
    public String displayName() {
        return "Call";
    }

    @Override
    public List<AstNode> getChildren() {
        return arguments != null ? List.of(functionName, arguments) : List.of(functionName);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CallNode other
                && Objects.equals(functionName, other.functionName) && Objects.equals(arguments, other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }
}
