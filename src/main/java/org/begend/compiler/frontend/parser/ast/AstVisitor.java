package org.begend.compiler.frontend.parser.ast;

/**
 * A visitor over the syntax tree. Each node's {@code accept} calls the overload for its own type.
 *
 * @param <T> The result type of the visit methods.
 */
public interface AstVisitor<T> {
    // Top level
    T visit(ProgramNode node);
    T visit(EnumNode node);
    T visit(EnumValueNode node);

    // Functions
    T visit(FunctionNode node);
    T visit(ParamNode node);

    // Statements
    T visit(VarDeclNode node);
    T visit(VarDeclItemNode node);
    T visit(AssignmentNode node);
    T visit(PrintNode node);
    T visit(ReadNode node);
    T visit(IfNode node);
    T visit(OrIfBranchNode node);
    T visit(ForNode node);
    T visit(ReturnNode node);
    T visit(BlockNode node);
    T visit(ExpressionStatementNode node);

    // Expressions
    T visit(BinaryExprNode node);
    T visit(UnaryExprNode node);
    T visit(LiteralNode node);
    T visit(VariableNode node);
    T visit(CallNode node);

    // Helper nodes
    T visit(TerminalNode node);
    T visit(NodeListNode<?> node);
}
