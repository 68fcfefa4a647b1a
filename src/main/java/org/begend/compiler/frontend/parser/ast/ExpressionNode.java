package org.begend.compiler.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface ExpressionNode extends AstNode
        permits BinaryExprNode, UnaryExprNode, LiteralNode, VariableNode, CallNode {
}
