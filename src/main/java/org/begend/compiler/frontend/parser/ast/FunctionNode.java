package org.begend.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function declaration. The declaration looks the same whether or not it was wrapped in
 * {@code begin ... end function}.
 *
 * @param id The node identifier.
 * @param functionName The terminal holding the function's name.
 * @param params The parameters, grouped under {@code "Params"} (possibly empty).
 * @param returnType The terminal holding the return type marker.
 * @param body The body statement, usually a {@link BlockNode}.
 */
public record FunctionNode(
        int id,
        TerminalNode functionName,
        NodeListNode<ParamNode> params,
        TerminalNode returnType,
        StatementNode body
) implements AstNode {

    @Override
    public String displayName() {
        return "Function";
    }

    public String name() {
        return functionName.text();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(functionName, params, returnType, body);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FunctionNode other
                && Objects.equals(functionName, other.functionName)
                && Objects.equals(params, other.params)
                && Objects.equals(returnType, other.returnType)
                && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, params, returnType, body);
    }
}
