package org.begend.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The root of every syntax tree.
 *
 * @param id The node identifier.
 * @param functions The function declarations in source order.
 * @param enums The enum declarations in source order.
 * @param statements The top-level statements in source order.
 */
public record ProgramNode(
        int id,
        List<FunctionNode> functions,
        List<EnumNode> enums,
        List<StatementNode> statements
) implements AstNode {

    public ProgramNode {
        functions = List.copyOf(functions);
        enums = List.copyOf(enums);
        statements = List.copyOf(statements);
    }

    @Override
    public String displayName() {
        return "Program";
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(functions.size() + enums.size() + statements.size());
        children.addAll(functions);
        children.addAll(enums);
        children.addAll(statements);
        return children;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProgramNode other
                && Objects.equals(functions, other.functions)
                && Objects.equals(enums, other.enums)
                && Objects.equals(statements, other.statements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functions, enums, statements);
    }
}
