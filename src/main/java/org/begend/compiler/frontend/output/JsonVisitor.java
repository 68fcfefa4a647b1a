package org.begend.compiler.frontend.output;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.begend.compiler.frontend.lexer.Token;
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
 * Converts a syntax tree into a Gson JSON tree.
 * <p>
 * Every node becomes {@code {"id": .., "name": ..}} with a {@code "children"} array when it has
 * children. Terminal nodes carry a {@code "token"} object ({@code type}, {@code lexeme},
 * {@code line}, {@code col}) instead.
 */
public class JsonVisitor implements AstVisitor<JsonElement> {

    private JsonObject visitNode(AstNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("id", node.id());
        json.addProperty("name", node.displayName());
        List<AstNode> children = node.getChildren();
        if (!children.isEmpty()) {
            JsonArray array = new JsonArray(children.size());
            for (AstNode child : children) {
                array.add(child.accept(this));
            }
            json.add("children", array);
        }
        return json;
    }

    @Override public JsonElement visit(ProgramNode node) { return visitNode(node); }
    @Override public JsonElement visit(EnumNode node) { return visitNode(node); }
    @Override public JsonElement visit(EnumValueNode node) { return visitNode(node); }
    @Override public JsonElement visit(FunctionNode node) { return visitNode(node); }
    @Override public JsonElement visit(ParamNode node) { return visitNode(node); }
    @Override public JsonElement visit(VarDeclNode node) { return visitNode(node); }
    @Override public JsonElement visit(VarDeclItemNode node) { return visitNode(node); }
    @Override public JsonElement visit(AssignmentNode node) { return visitNode(node); }
    @Override public JsonElement visit(PrintNode node) { return visitNode(node); }
    @Override public JsonElement visit(ReadNode node) { return visitNode(node); }
    @Override public JsonElement visit(IfNode node) { return visitNode(node); }
    @Override public JsonElement visit(OrIfBranchNode node) { return visitNode(node); }
    @Override public JsonElement visit(ForNode node) { return visitNode(node); }
    @Override public JsonElement visit(ReturnNode node) { return visitNode(node); }
    @Override public JsonElement visit(BlockNode node) { return visitNode(node); }
    @Override public JsonElement visit(ExpressionStatementNode node) { return visitNode(node); }
    @Override public JsonElement visit(BinaryExprNode node) { return visitNode(node); }
    @Override public JsonElement visit(UnaryExprNode node) { return visitNode(node); }
    @Override public JsonElement visit(LiteralNode node) { return visitNode(node); }
    @Override public JsonElement visit(VariableNode node) { return visitNode(node); }
    @Override public JsonElement visit(CallNode node) { return visitNode(node); }
    @Override public JsonElement visit(NodeListNode<?> node) { return visitNode(node); }

    @Override
    public JsonElement visit(TerminalNode node) {
        Token token = node.token();
        JsonObject tokenJson = new JsonObject();
        tokenJson.addProperty("type", token.type().name());
        tokenJson.addProperty("lexeme", token.text());
        tokenJson.addProperty("line", token.line());
        tokenJson.addProperty("col", token.column());

        JsonObject json = new JsonObject();
        json.addProperty("id", node.id());
        json.addProperty("name", node.displayName());
        json.add("token", tokenJson);
        return json;
    }
}
