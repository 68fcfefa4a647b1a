package org.begend.compiler.frontend.parser.ast;

import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Node equality compares structure and tokens; identifiers never take part.
 */
@Tag("unit")
class AstNodeEqualityTest {

    private static Token token(TokenType type, String text, int column) {
        return new Token(type, text, null, 1, column, "<memory>");
    }

    @Test
    void sameTokensFromDifferentFactoriesAreEqual() {
        Token five = token(TokenType.INT_LITERAL, "5", 1);
        AstFactory factory = new AstFactory();
        factory.literal(token(TokenType.INT_LITERAL, "9", 3));

        LiteralNode shifted = factory.literal(five);
        LiteralNode fresh = new AstFactory().literal(five);

        assertThat(shifted.id()).isNotEqualTo(fresh.id());
        assertThat(shifted).isEqualTo(fresh).hasSameHashCodeAs(fresh);
    }

    @Test
    void differentStructureIsNotEqual() {
        AstFactory factory = new AstFactory();
        Token a = token(TokenType.IDENT, "a", 1);

        VariableNode scalar = factory.variable(a, List.of());
        VariableNode indexed = factory.variable(a, List.of(factory.literal(token(TokenType.INT_LITERAL, "0", 3))));

        assertThat(scalar).isNotEqualTo(indexed);
    }

    @Test
    void groupsCompareLabelsAndMembers() {
        AstFactory factory = new AstFactory();
        EnumValueNode red = factory.enumValue(token(TokenType.IDENT, "RED", 1));

        NodeListNode<EnumValueNode> values = factory.list("Values", List.of(red));
        NodeListNode<EnumValueNode> sameValues = new AstFactory().list("Values", List.of(red));
        NodeListNode<EnumValueNode> relabelled = factory.list("Variables", List.of(red));

        assertThat(values).isEqualTo(sameValues);
        assertThat(values).isNotEqualTo(relabelled);
    }

    @Test
    void bareReturnsAreEqual() {
        assertThat(new AstFactory().returnStatement(null))
                .isEqualTo(new AstFactory(NodeIdGenerator.shared()).returnStatement(null));
    }
}
