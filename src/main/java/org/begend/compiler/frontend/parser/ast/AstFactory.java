package org.begend.compiler.frontend.parser.ast;

import org.begend.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * Builds syntax-tree nodes and assigns their identifiers.
 * <p>
 * Terminal and list nodes are created before the node that owns them, so a parent's identifier
 * is always greater than the identifiers of all its descendants.
 */
public final class AstFactory {

    private final NodeIdGenerator ids;

    /**
     * Creates a factory that numbers nodes with its own generator, starting at 1.
     */
    public AstFactory() {
        this(new NodeIdGenerator());
    }

    /**
     * Creates a factory that numbers nodes with the given generator.
     * @param ids The identifier source.
     */
    public AstFactory(NodeIdGenerator ids) {
        this.ids = ids;
    }

    public TerminalNode terminal(Token token, String label) {
        return new TerminalNode(ids.next(), label, token);
    }

    public <T extends AstNode> NodeListNode<T> list(String label, List<T> nodes) {
        return new NodeListNode<>(ids.next(), label, nodes);
    }

    public ProgramNode program(List<FunctionNode> functions, List<EnumNode> enums, List<StatementNode> statements) {
        return new ProgramNode(ids.next(), functions, enums, statements);
    }

    public EnumNode enumDeclaration(Token name, List<EnumValueNode> values) {
        TerminalNode enumName = terminal(name, "EnumName");
        NodeListNode<EnumValueNode> valueList = list("Values", values);
        return new EnumNode(ids.next(), enumName, valueList);
    }

    public EnumValueNode enumValue(Token name) {
        TerminalNode valueName = terminal(name, "ValueName");
        return new EnumValueNode(ids.next(), valueName);
    }

    public FunctionNode function(Token name, List<ParamNode> params, Token returnType, StatementNode body) {
        TerminalNode functionName = terminal(name, "FunctionName");
        NodeListNode<ParamNode> paramList = list("Params", params);
        TerminalNode returnTypeTerminal = terminal(returnType, "ReturnType");
        return new FunctionNode(ids.next(), functionName, paramList, returnTypeTerminal, body);
    }

    public ParamNode param(Token name, Token type) {
        TerminalNode paramName = terminal(name, "ParamName");
        TerminalNode paramType = terminal(type, "ParamType");
        return new ParamNode(ids.next(), paramName, paramType);
    }

    public VarDeclNode varDecl(Token type, List<ExpressionNode> dimensions, List<VarDeclItemNode> variables) {
        TerminalNode typeTerminal = terminal(type, "Type");
        NodeListNode<ExpressionNode> dimensionList = list("Dimensions", dimensions);
        NodeListNode<VarDeclItemNode> variableList = list("Variables", variables);
        return new VarDeclNode(ids.next(), typeTerminal, dimensionList, variableList);
    }

    public VarDeclItemNode varDeclItem(Token name) {
        TerminalNode varName = terminal(name, "VarName");
        return new VarDeclItemNode(ids.next(), varName);
    }

    public AssignmentNode assignment(ExpressionNode source, ExpressionNode target) {
        return new AssignmentNode(ids.next(), source, target);
    }

    public PrintNode print(ExpressionNode expression) {
        return new PrintNode(ids.next(), expression);
    }

    public ReadNode read(ExpressionNode target) {
        return new ReadNode(ids.next(), target);
    }

    /**
     * Builds an if statement.
     * @param condition The first condition.
     * @param thenBranch The statement for the first condition.
     * @param orIfBranches The {@code or if} branches, possibly empty.
     * @param elseBranch The else statement, or null.
     * @return The new node.
     */
    public IfNode ifStatement(ExpressionNode condition, StatementNode thenBranch,
                              List<OrIfBranchNode> orIfBranches, StatementNode elseBranch) {
        return new IfNode(ids.next(), condition, thenBranch, orIfBranches, elseBranch);
    }

    public OrIfBranchNode orIfBranch(ExpressionNode condition, StatementNode body) {
        return new OrIfBranchNode(ids.next(), condition, body);
    }

    public ForNode forLoop(Token variable, ExpressionNode from, ExpressionNode to, StatementNode body) {
        TerminalNode varName = terminal(variable, "VarName");
        return new ForNode(ids.next(), varName, from, to, body);
    }

    public ReturnNode returnStatement(ExpressionNode expression) {
        return new ReturnNode(ids.next(), expression);
    }

    public BlockNode block(List<StatementNode> statements) {
        return new BlockNode(ids.next(), statements);
    }

    public ExpressionStatementNode expressionStatement(ExpressionNode expression) {
        return new ExpressionStatementNode(ids.next(), expression);
    }

    public BinaryExprNode binary(ExpressionNode left, Token operator, ExpressionNode right) {
        TerminalNode operatorTerminal = terminal(operator, "Operator");
        return new BinaryExprNode(ids.next(), left, operatorTerminal, right);
    }

    public UnaryExprNode unary(Token operator, ExpressionNode operand) {
        TerminalNode operatorTerminal = terminal(operator, "Operator");
        return new UnaryExprNode(ids.next(), operatorTerminal, operand);
    }

    public LiteralNode literal(Token token) {
        TerminalNode value = terminal(token, "Value");
        return new LiteralNode(ids.next(), value);
    }

    /**
     * Builds a variable reference. The {@code "Indices"} group is only created for array access.
     * @param name The variable name token.
     * @param indices The index expressions, empty for a scalar reference.
     * @return The new node.
     */
    public VariableNode variable(Token name, List<ExpressionNode> indices) {
        TerminalNode varName = terminal(name, "VarName");
        NodeListNode<ExpressionNode> indexList = indices.isEmpty() ? null : list("Indices", indices);
        return new VariableNode(ids.next(), varName, indexList);
    }

    /**
     * Builds a call. The {@code "Arguments"} group is only created when there are arguments.
     * @param name The called name token.
     * @param arguments The argument expressions, possibly empty.
     * @return The new node.
     */
    public CallNode call(Token name, List<ExpressionNode> arguments) {
        TerminalNode functionName = terminal(name, "FunctionName");
        NodeListNode<ExpressionNode> argumentList = arguments.isEmpty() ? null : list("Arguments", arguments);
        return new CallNode(ids.next(), functionName, argumentList);
    }
}
