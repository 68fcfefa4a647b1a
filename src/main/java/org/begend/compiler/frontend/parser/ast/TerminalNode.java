package org.begend.compiler.frontend.parser.ast;

import org.begend.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * A leaf that exposes a single token (a name, an operator, a type marker, a literal) as an
 * addressable node of the tree.
 *
 * @param id The node identifier.
 * @param label The descriptive label shown in place of a variant name, e.g. {@code "VarName"}.
 * @param token The wrapped token.
 */
public record TerminalNode(
        int id,
        String label,
        Token token
) implements AstNode {

    @Override
    public String displayName() {
        return label;
    }

    /**
     * Returns the source text of the wrapped token.
     * @return The lexeme.
     */
    public String text() {
        return token.text();
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    /**
     * Compares structure and tokens only; the identifier is ignored.
     */
    @Override
    public boolean equals(Object o) {
        return o instanceof TerminalNode other
                && Objects.equals(label, other.label) && Objects.equals(token, other.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, token);
    }
}
