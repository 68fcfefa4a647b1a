package org.begend.compiler.frontend.parser;

import org.begend.compiler.diagnostics.DiagnosticsEngine;
import org.begend.compiler.frontend.lexer.Lexer;
import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;
import org.begend.compiler.frontend.output.PrettyPrintVisitor;
import org.begend.compiler.frontend.parser.ast.AssignmentNode;
import org.begend.compiler.frontend.parser.ast.BinaryExprNode;
import org.begend.compiler.frontend.parser.ast.BlockNode;
import org.begend.compiler.frontend.parser.ast.CallNode;
import org.begend.compiler.frontend.parser.ast.EnumNode;
import org.begend.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.begend.compiler.frontend.parser.ast.ForNode;
import org.begend.compiler.frontend.parser.ast.FunctionNode;
import org.begend.compiler.frontend.parser.ast.IfNode;
import org.begend.compiler.frontend.parser.ast.LiteralNode;
import org.begend.compiler.frontend.parser.ast.PrintNode;
import org.begend.compiler.frontend.parser.ast.ProgramNode;
import org.begend.compiler.frontend.parser.ast.ReadNode;
import org.begend.compiler.frontend.parser.ast.ReturnNode;
import org.begend.compiler.frontend.parser.ast.UnaryExprNode;
import org.begend.compiler.frontend.parser.ast.VarDeclNode;
import org.begend.compiler.frontend.parser.ast.VariableNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify that statements, declarations and expressions are turned into the expected
 * tree shapes, including the optional terminators of the grammar, and that syntax errors point
 * at the right tokens.
 */
@Tag("unit")
public class ParserTest {

    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private ProgramNode parse(String... lines) {
        List<Token> tokens = new Lexer(String.join("\n", lines), diagnostics).scanTokens();
        assertThat(diagnostics.hasErrors()).as("lexical errors: %s", diagnostics.summary()).isFalse();
        return new Parser(tokens, diagnostics).parse();
    }

    private ParseError parseFailing(String... lines) {
        return catchThrowableOfType(() -> parse(lines), ParseError.class);
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        ProgramNode program = parse("2 + 3 * 4;");

        ExpressionStatementNode statement = (ExpressionStatementNode) program.statements().get(0);
        BinaryExprNode addition = (BinaryExprNode) statement.expression();
        assertThat(addition.operatorType()).isEqualTo(TokenType.PLUS);
        assertThat(addition.left()).isInstanceOf(LiteralNode.class);
        assertThat(addition.right()).isInstanceOfSatisfying(BinaryExprNode.class,
                right -> assertThat(right.operatorType()).isEqualTo(TokenType.STAR));
    }

    @Test
    void testBinaryOperatorsAreLeftAssociative() {
        ProgramNode program = parse("10 - 4 - 3;");

        BinaryExprNode outer = (BinaryExprNode) ((ExpressionStatementNode) program.statements().get(0)).expression();
        assertThat(outer.left()).isInstanceOf(BinaryExprNode.class);
        assertThat(outer.right()).isInstanceOfSatisfying(LiteralNode.class,
                literal -> assertThat(literal.token().text()).isEqualTo("3"));
    }

    @Test
    void testLogicalOperatorPrecedence() {
        ProgramNode program = parse("a or b and c = d;");

        BinaryExprNode or = (BinaryExprNode) ((ExpressionStatementNode) program.statements().get(0)).expression();
        assertThat(or.operatorType()).isEqualTo(TokenType.OR);
        BinaryExprNode and = (BinaryExprNode) or.right();
        assertThat(and.operatorType()).isEqualTo(TokenType.AND);
        assertThat(((BinaryExprNode) and.right()).operatorType()).isEqualTo(TokenType.EQ);
    }

    @Test
    void testUnaryOperatorsNest() {
        ProgramNode program = parse("-x * 2;", "not not ok;");

        BinaryExprNode product = (BinaryExprNode) ((ExpressionStatementNode) program.statements().get(0)).expression();
        assertThat(product.left()).isInstanceOf(UnaryExprNode.class);

        UnaryExprNode outer = (UnaryExprNode) ((ExpressionStatementNode) program.statements().get(1)).expression();
        assertThat(outer.operator().token().type()).isEqualTo(TokenType.NOT);
        assertThat(outer.operand()).isInstanceOf(UnaryExprNode.class);
    }

    @Test
    void testAssignmentFlowsLeftToRight() {
        ProgramNode program = parse("5 -> a;");

        AssignmentNode assignment = (AssignmentNode) program.statements().get(0);
        assertThat(assignment.source()).isInstanceOfSatisfying(LiteralNode.class,
                literal -> assertThat(literal.token().value()).isEqualTo(5));
        assertThat(assignment.target()).isInstanceOfSatisfying(VariableNode.class,
                variable -> assertThat(variable.name()).isEqualTo("a"));
        assertThat(assignment.getChildren()).containsExactly(assignment.source(), assignment.target());
    }

    @Test
    void testBeginWrappedAndBareFunctionsAreEquivalent() {
        String wrapped = PrettyPrintVisitor.render(parse("begin function f(): int return 1; end function"));
        diagnostics = new DiagnosticsEngine();
        String bare = PrettyPrintVisitor.render(parse("function f(): int return 1; end function"));

        assertThat(wrapped).isEqualTo(bare);
    }

    @Test
    void testBareFunctionWithoutEndFunction() {
        ProgramNode program = parse("function f(): int return 1;", "print(f());");

        assertThat(program.functions()).hasSize(1);
        assertThat(program.statements()).singleElement().isInstanceOf(PrintNode.class);
    }

    @Test
    void testBeginFunctionWithBlockBodyNeedsOnlyFunctionKeyword() {
        ProgramNode program = parse(
                "begin function add(a: int, b: real): real",
                "begin",
                "  return a + b",
                "end function");

        FunctionNode function = program.functions().get(0);
        assertThat(function.name()).isEqualTo("add");
        assertThat(function.params().nodes()).extracting(p -> p.paramName().text()).containsExactly("a", "b");
        assertThat(function.returnType().text()).isEqualTo("real");
        assertThat(function.body()).isInstanceOfSatisfying(BlockNode.class, block ->
                assertThat(block.statements()).singleElement().isInstanceOf(ReturnNode.class));
    }

    @Test
    void testFunctionParametersRequireParentheses() {
        ParseError error = parseFailing("function f: int return 1;");

        assertThat(error.getMessage()).isEqualTo("Expected '(' after function name");
        assertThat(error.getErrorToken().type()).isEqualTo(TokenType.COLON);
    }

    @Test
    void testIfWithAndWithoutEndHaveTheSameShape() {
        String withEnd = PrettyPrintVisitor.render(parse("if (a < 10) print(1); end"));
        diagnostics = new DiagnosticsEngine();
        String withoutEnd = PrettyPrintVisitor.render(parse("if (a < 10) print(1);"));

        assertThat(withEnd).isEqualTo(withoutEnd);
    }

    @Test
    void testIfWithOrIfAndElse() {
        ProgramNode program = parse("if (a = 1) print(1); or if (a = 2) print(2); else print(3);");

        IfNode ifNode = (IfNode) program.statements().get(0);
        assertThat(ifNode.orIfBranches()).hasSize(1);
        assertThat(ifNode.elseBranch()).isInstanceOf(PrintNode.class);
        assertThat(ifNode.getChildren()).hasSize(4);
    }

    @Test
    void testBareEndAfterIfBindsToTheIf() {
        ParseError error = parseFailing(
                "function f(): int",
                "  if (x) return 1; else return 0;",
                "end function");

        // The 'end' closed the if, so 'function' starts a new declaration without a name.
        assertThat(error.getMessage()).isEqualTo("Expected function name");
        assertThat(error.getLastToken().type()).isEqualTo(TokenType.FUNCTION);
    }

    @Test
    void testBeginIfAndBeginFor() {
        ProgramNode program = parse(
                "begin if (ok) print(1);",
                "begin for (i goes from 1 to 10) print(i);");

        assertThat(program.statements()).hasSize(2);
        assertThat(program.statements().get(0)).isInstanceOf(IfNode.class);
        assertThat(program.statements().get(1)).isInstanceOf(ForNode.class);
    }

    @Test
    void testForLoopWithEndFor() {
        ProgramNode program = parse("for (i goes from 1 to n - 1) begin read(x[i]); end end for");

        ForNode loop = (ForNode) program.statements().get(0);
        assertThat(loop.varName().text()).isEqualTo("i");
        assertThat(loop.to()).isInstanceOf(BinaryExprNode.class);
        BlockNode body = (BlockNode) loop.body();
        assertThat(body.statements()).singleElement().isInstanceOfSatisfying(ReadNode.class,
                read -> assertThat(((VariableNode) read.target()).isArrayAccess()).isTrue());
    }

    @Test
    void testReturnWithoutExpressionOrSemicolonBeforeEnd() {
        ProgramNode program = parse("function f(): int begin return end");

        BlockNode body = (BlockNode) program.functions().get(0).body();
        ReturnNode ret = (ReturnNode) body.statements().get(0);
        assertThat(ret.expression()).isNull();
        assertThat(ret.getChildren()).isEmpty();
    }

    @Test
    void testReturnAtEndOfInputNeedsNoSemicolon() {
        ProgramNode program = parse("return x + 1");

        assertThat(program.statements()).singleElement().isInstanceOfSatisfying(ReturnNode.class,
                ret -> assertThat(ret.expression()).isInstanceOf(BinaryExprNode.class));
    }

    @Test
    void testBareReturnBeforeElse() {
        ProgramNode program = parse("if (x) return; else print(0);");

        IfNode ifNode = (IfNode) program.statements().get(0);
        assertThat(ifNode.thenBranch()).isInstanceOfSatisfying(ReturnNode.class,
                ret -> assertThat(ret.expression()).isNull());
        assertThat(ifNode.elseBranch()).isInstanceOf(PrintNode.class);
    }

    @Test
    void testReturnBeforeElseStillNeedsSemicolon() {
        ParseError error = parseFailing("if (x) return else print(0);");

        assertThat(error.getMessage()).isEqualTo("Expected ';' after 'return' statement");
        assertThat(error.getErrorToken().type()).isEqualTo(TokenType.ELSE);
        assertThat(error.getLastToken().type()).isEqualTo(TokenType.RETURN);
    }

    @Test
    void testReturnBeforeOrIfStillNeedsSemicolon() {
        ParseError error = parseFailing("if (x) return or if (y) print(1);");

        assertThat(error.getMessage()).isEqualTo("Expected ';' after 'return' statement");
        assertThat(error.getErrorToken().type()).isEqualTo(TokenType.OR);
    }

    @Test
    void testCallsAndArrayAccess() {
        ProgramNode program = parse("f(1, x[2][3]) -> grid[i][j];", "g();");

        AssignmentNode assignment = (AssignmentNode) program.statements().get(0);
        CallNode call = (CallNode) assignment.source();
        assertThat(call.name()).isEqualTo("f");
        assertThat(call.argumentExpressions()).hasSize(2);
        assertThat(call.argumentExpressions().get(1)).isInstanceOfSatisfying(VariableNode.class,
                v -> assertThat(v.indexExpressions()).hasSize(2));
        assertThat(((VariableNode) assignment.target()).indices().displayName()).isEqualTo("Indices");

        CallNode noArgs = (CallNode) ((ExpressionStatementNode) program.statements().get(1)).expression();
        assertThat(noArgs.arguments()).isNull();
        assertThat(noArgs.getChildren()).hasSize(1);
    }

    @Test
    void testArrayDeclarationWithSeveralVariables() {
        ProgramNode program = parse("int[3][4] grid, other;");

        VarDeclNode declaration = (VarDeclNode) program.statements().get(0);
        assertThat(declaration.type().text()).isEqualTo("int");
        assertThat(declaration.dimensions().nodes()).hasSize(2);
        assertThat(declaration.variables().nodes()).extracting(v -> v.varName().text()).containsExactly("grid", "other");
    }

    @Test
    void testArrayDimensionMustBeIntegerLiteral() {
        ParseError error = parseFailing("int[n] a;");

        assertThat(error.getMessage()).isEqualTo("Expected integer literal as array dimension");
    }

    @Test
    void testMissingVariableNameReportsSemicolonAndIntKeyword() {
        ParseError error = parseFailing("int ;");

        assertThat(error.getErrorToken()).extracting(Token::type, Token::line, Token::column)
                .containsExactly(TokenType.SEMICOLON, 1, 5);
        assertThat(error.getLastToken()).extracting(Token::type, Token::text).containsExactly(TokenType.INT, "int");
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void testErrorAtEndOfInputPointsAtLastRealToken() {
        ParseError error = parseFailing("print(1)");

        assertThat(error.getMessage()).isEqualTo("Expected ';' after 'print' statement");
        assertThat(error.getErrorToken().type()).isEqualTo(TokenType.RPAREN);
    }

    @Test
    void testMissingPrimaryExpression() {
        ParseError error = parseFailing("print();");

        assertThat(error.getMessage()).isEqualTo("Expected expression");
        assertThat(error.getLastToken().type()).isEqualTo(TokenType.LPAREN);
    }

    @Test
    void testEnumWithoutSemicolonBeforeDeclaration() {
        ProgramNode program = parse("enum Color { RED, GREEN, BLUE }", "int x;");

        EnumNode color = program.enums().get(0);
        assertThat(color.name()).isEqualTo("Color");
        assertThat(color.values().nodes()).extracting(v -> v.valueName().text()).containsExactly("RED", "GREEN", "BLUE");
        assertThat(program.statements()).singleElement().isInstanceOf(VarDeclNode.class);
    }

    @Test
    void testEnumNeedsSemicolonBeforeOtherStatements() {
        ParseError error = parseFailing("enum E { A } print(1);");

        assertThat(error.getMessage()).isEqualTo("Expected ';' after enum declaration");
    }

    @Test
    void testProgramChildrenKeepGroupOrder() {
        ProgramNode program = parse("print(1);", "enum E { A };", "function f(): int return 1;");

        assertThat(program.getChildren()).containsExactly(
                program.functions().get(0), program.enums().get(0), program.statements().get(0));
    }

    @Test
    void testTokenListMustEndWithEof() {
        Token token = new Token(TokenType.IDENT, "x", null, 1, 1, "<memory>");

        assertThatThrownBy(() -> new Parser(List.of(token), diagnostics))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
