package org.begend.compiler.frontend.parser.ast;

import org.begend.compiler.diagnostics.DiagnosticsEngine;
import org.begend.compiler.frontend.TreeWalker;
import org.begend.compiler.frontend.lexer.Lexer;
import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;
import org.begend.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies how the {@link AstFactory} and {@link NodeIdGenerator} number syntax-tree nodes.
 */
@Tag("unit")
class NodeIdentifierTest {

    private static final String PROGRAM = String.join("\n",
            "enum Mode { ON, OFF }",
            "int[2] v;",
            "function f(a: int): int return a * 2;",
            "if (f(1) > 0 and not done) print(v[0]); or if (x) read(v[1]); else begin 1 -> x; end",
            "for (i goes from 1 to 2) print(-i); end for");

    private static ProgramNode parse(NodeIdGenerator ids) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(PROGRAM, diagnostics).scanTokens(), diagnostics, ids).parse();
    }

    private static List<AstNode> allNodes(AstNode root) {
        List<AstNode> nodes = new ArrayList<>();
        new TreeWalker(Map.of(), nodes::add).walk(root);
        return nodes;
    }

    private static void assertParentIdExceedsDescendants(AstNode node) {
        for (AstNode descendant : allNodes(node)) {
            if (descendant != node) {
                assertThat(descendant.id()).as("%s below %s", descendant.displayName(), node.displayName())
                        .isLessThan(node.id());
            }
        }
        node.getChildren().forEach(NodeIdentifierTest::assertParentIdExceedsDescendants);
    }

    @Test
    void identifiersAreExactlyOneToNodeCount() {
        ProgramNode program = parse(new NodeIdGenerator());

        List<Integer> ids = allNodes(program).stream().map(AstNode::id).sorted().toList();

        assertThat(ids).containsExactlyElementsOf(IntStream.rangeClosed(1, ids.size()).boxed().toList());
        assertThat(program.id()).isEqualTo(ids.size());
    }

    @Test
    void parentIdentifierExceedsAllDescendants() {
        assertParentIdExceedsDescendants(parse(new NodeIdGenerator()));
    }

    @Test
    void sharedGeneratorNeverRepeatsIdentifiers() {
        NodeIdGenerator ids = new NodeIdGenerator();

        ProgramNode first = parse(ids);
        ProgramNode second = parse(ids);

        assertThat(allNodes(second)).allSatisfy(node -> assertThat(node.id()).isGreaterThan(first.id()));
        assertThat(ids.peekNext()).isEqualTo(second.id() + 1);
    }

    @Test
    void generatorStartsAtOne() {
        NodeIdGenerator ids = new NodeIdGenerator();

        assertThat(ids.peekNext()).isEqualTo(1);
        assertThat(ids.next()).isEqualTo(1);
        assertThat(ids.next()).isEqualTo(2);
    }

    @Test
    void optionalGroupsAreOnlyBuiltWhenNonEmpty() {
        AstFactory factory = new AstFactory();
        Token name = new Token(TokenType.IDENT, "g", null, 1, 1, "<memory>");

        CallNode call = factory.call(name, List.of());
        VariableNode variable = factory.variable(name, List.of());

        assertThat(call.getChildren()).extracting(AstNode::displayName).containsExactly("FunctionName");
        assertThat(variable.getChildren()).extracting(AstNode::displayName).containsExactly("VarName");
        assertThat(variable.isArrayAccess()).isFalse();
        assertThat(variable.id()).isEqualTo(4);
    }
}
