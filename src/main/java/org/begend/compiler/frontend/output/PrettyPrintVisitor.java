package org.begend.compiler.frontend.output;

import org.begend.compiler.frontend.parser.ast.AssignmentNode;
import org.begend.compiler.frontend.parser.ast.AstNode;
import org.begend.compiler.frontend.parser.ast.AstVisitor;
import org.begend.compiler.frontend.parser.ast.BinaryExprNode;
import org.begend.compiler.frontend.parser.ast.BlockNode;
import org.begend.compiler.frontend.parser.ast.CallNode;
import org.begend.compiler.frontend.parser.ast.EnumNode;
import org.begend.compiler.frontend.parser.ast.EnumValueNode;
import org.begend.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.begend.compiler.frontend.parser.ast.ForNode;
import org.begend.compiler.frontend.parser.ast.FunctionNode;
import org.begend.compiler.frontend.parser.ast.IfNode;
import org.begend.compiler.frontend.parser.ast.LiteralNode;
import org.begend.compiler.frontend.parser.ast.NodeListNode;
import org.begend.compiler.frontend.parser.ast.OrIfBranchNode;
import org.begend.compiler.frontend.parser.ast.ParamNode;
import org.begend.compiler.frontend.parser.ast.PrintNode;
import org.begend.compiler.frontend.parser.ast.ProgramNode;
import org.begend.compiler.frontend.parser.ast.ReadNode;
import org.begend.compiler.frontend.parser.ast.ReturnNode;
import org.begend.compiler.frontend.parser.ast.TerminalNode;
import org.begend.compiler.frontend.parser.ast.UnaryExprNode;
import org.begend.compiler.frontend.parser.ast.VarDeclItemNode;
import org.begend.compiler.frontend.parser.ast.VarDeclNode;
import org.begend.compiler.frontend.parser.ast.VariableNode;

import java.util.List;

/**
 * Renders a syntax tree as an indented outline, one node per line:
 * <pre>
 * Program (ID: 9)
 *   Print (ID: 8)
 *     Literal (ID: 7)
 *       Value (ID: 6)
 * </pre>
 * Each level of depth adds two spaces. Lines are separated by {@code \n}; there is no trailing newline.
 */
public class PrettyPrintVisitor implements AstVisitor<String> {

    private static final String INDENT = "  ";

    private int depth = 0;

    /**
     * Renders the given tree.
     * @param root The root node.
     * @return The outline text.
     */
    public static String render(AstNode root) {
        return root.accept(new PrettyPrintVisitor());
    }

    private String header(AstNode node) {
        return INDENT.repeat(depth) + node.displayName() + " (ID: " + node.id() + ")";
    }

    private String visitNode(AstNode node) {
        StringBuilder sb = new StringBuilder(header(node));
        List<AstNode> children = node.getChildren();
        if (!children.isEmpty()) {
            depth++;
            for (AstNode child : children) {
                sb.append('\n').append(child.accept(this));
            }
            depth--;
        }
        return sb.toString();
    }

    @Override public String visit(ProgramNode node) { return visitNode(node); }
    @Override public String visit(EnumNode node) { return visitNode(node); }
    @Override public String visit(EnumValueNode node) { return visitNode(node); }
    @Override public String visit(FunctionNode node) { return visitNode(node); }
    @Override public String visit(ParamNode node) { return visitNode(node); }
    @Override public String visit(VarDeclNode node) { return visitNode(node); }
    @Override public String visit(VarDeclItemNode node) { return visitNode(node); }
    @Override public String visit(AssignmentNode node) { return visitNode(node); }
    @Override public String visit(PrintNode node) { return visitNode(node); }
    @Override public String visit(ReadNode node) { return visitNode(node); }
    @Override public String visit(IfNode node) { return visitNode(node); }
    @Override public String visit(OrIfBranchNode node) { return visitNode(node); }
    @Override public String visit(ForNode node) { return visitNode(node); }
    @Override public String visit(ReturnNode node) { return visitNode(node); }
    @Override public String visit(BlockNode node) { return visitNode(node); }
    @Override public String visit(ExpressionStatementNode node) { return visitNode(node); }
    @Override public String visit(BinaryExprNode node) { return visitNode(node); }
    @Override public String visit(UnaryExprNode node) { return visitNode(node); }
    @Override public String visit(LiteralNode node) { return visitNode(node); }
    @Override public String visit(VariableNode node) { return visitNode(node); }
    @Override public String visit(CallNode node) { return visitNode(node); }
    @Override public String visit(TerminalNode node) { return header(node); }
    @Override public String visit(NodeListNode<?> node) { return visitNode(node); }
}
