package org.begend.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the syntax tree.
 * <p>
 * The set of node variants is closed. Every node carries an identifier that is assigned once,
 * when the node is built by the {@link AstFactory}, and is used for display only. It takes no
 * part in {@code equals} and {@code hashCode}: trees built from the same tokens are equal whatever
 * their numbering.
 */
public sealed interface AstNode
        permits ProgramNode, EnumNode, EnumValueNode, FunctionNode, ParamNode, VarDeclItemNode,
                OrIfBranchNode, TerminalNode, NodeListNode, StatementNode, ExpressionNode {

    /**
     * Returns the identifier assigned to this node at construction.
     * @return The node identifier.
     */
    int id();

    /**
     * Returns the human-readable name of this node, e.g. {@code "BinaryExpr"} or, for terminal
     * and list nodes, their label.
     * @return The display name.
     */
    String displayName();

    /**
     * Returns a list of the direct child nodes in source order.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Dispatches to the {@code visit} overload of the given visitor that matches this node's type.
     * @param visitor The visitor.
     * @param <T> The result type of the visitor.
     * @return The visitor's result for this node.
     */
    <T> T accept(AstVisitor<T> visitor);
}
