package org.begend.compiler.frontend.parser.ast;

import org.begend.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An integer, real or boolean literal.
 *
 * @param id The node identifier.
 * @param value The terminal holding the literal token.
 */
public record LiteralNode(
        int id,
        TerminalNode value
) implements ExpressionNode {

    /**
     * Gets the literal token; its {@link Token#value()} holds the parsed Integer, Double or Boolean.
     * @return The literal token.
     */
    public Token token() {
        return value.token();
    }

    @Override
    public String displayName() {
        return "Literal";
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralNode other
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }
}
