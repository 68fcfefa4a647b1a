package org.begend.compiler.api;

import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.parser.ast.ProgramNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the language front end.
 */
public interface IFrontEnd {

    /**
     * Scans the given source code into tokens.
     *
     * @param sourceLines The lines of the source code.
     * @param programName A name for the source, used in diagnostics and token positions.
     * @return The tokens, terminated by an EOF token.
     * @throws CompilationException if the source contains lexical errors.
     */
    List<Token> tokenize(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Scans and parses the given source code.
     *
     * @param sourceLines The lines of the source code.
     * @param programName A name for the source, used in diagnostics and token positions.
     * @return The root of the syntax tree.
     * @throws SyntaxException if the tokens do not match the grammar.
     * @throws CompilationException if the source contains lexical errors.
     */
    ProgramNode parse(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Parses the source code from a file.
     * @param programPath The path to the source file.
     * @return The root of the syntax tree.
     * @throws CompilationException if the source contains lexical or syntax errors.
     * @throws IOException if the file cannot be read.
     */
    default ProgramNode parse(Path programPath) throws CompilationException, IOException {
        return parse(Files.readAllLines(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
