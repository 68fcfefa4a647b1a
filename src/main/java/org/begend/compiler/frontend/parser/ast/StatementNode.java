package org.begend.compiler.frontend.parser.ast;

/**
 * A node that can appear in statement position: at top level, in a block, or as the body of a
 * function, branch or loop.
 */
public sealed interface StatementNode extends AstNode
        permits VarDeclNode, AssignmentNode, PrintNode, ReadNode, IfNode, ForNode, ReturnNode,
                BlockNode, ExpressionStatementNode {
}
