package org.begend.compiler.frontend.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.begend.compiler.frontend.parser.ast.AstNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Serializes syntax trees to JSON text using the {@link JsonVisitor}.
 */
public final class SyntaxTreeJson {

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();

    private SyntaxTreeJson() {}

    /**
     * Serializes a tree.
     * @param root The root node.
     * @param pretty Whether to indent the output by two spaces per level.
     * @return The JSON text.
     */
    public static String toJson(AstNode root, boolean pretty) {
        return (pretty ? PRETTY : COMPACT).toJson(root.accept(new JsonVisitor()));
    }

    /**
     * Serializes a tree and writes it to a file as UTF-8, replacing any previous content.
     * @param root The root node.
     * @param target The file to write.
     * @param pretty Whether to indent the output.
     * @throws IOException if the file cannot be written.
     */
    public static void write(AstNode root, Path target, boolean pretty) throws IOException {
        Files.writeString(target, toJson(root, pretty), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }
}
