package org.begend.compiler.frontend;

import org.begend.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing a syntax tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * so that callers interested in a few node types need not implement every visit method.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;
    private final Consumer<AstNode> fallback;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this(handlers, n -> {});
    }

    /**
     * Constructs a new TreeWalker with a handler for node classes that have no entry in the map.
     * @param handlers A map from AST node classes to their corresponding handlers.
     * @param fallback The handler applied to every other node.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers, Consumer<AstNode> fallback) {
        this.handlers = handlers;
        this.fallback = fallback;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively, parents before children.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), fallback).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Counts the nodes of a tree, the root included.
     * @param root The root of the tree.
     * @return The number of nodes.
     */
    public static int countNodes(AstNode root) {
        int[] count = {0};
        new TreeWalker(Map.of(), n -> count[0]++).walk(root);
        return count[0];
    }
}
