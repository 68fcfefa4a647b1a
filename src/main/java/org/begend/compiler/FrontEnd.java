package org.begend.compiler;

import org.begend.compiler.api.CompilationException;
import org.begend.compiler.api.IFrontEnd;
import org.begend.compiler.api.NodeIdMode;
import org.begend.compiler.api.SourceInfo;
import org.begend.compiler.api.SyntaxException;
import org.begend.compiler.diagnostics.CompilerLogger;
import org.begend.compiler.diagnostics.Diagnostic;
import org.begend.compiler.diagnostics.DiagnosticsEngine;
import org.begend.compiler.frontend.TreeWalker;
import org.begend.compiler.frontend.lexer.Lexer;
import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;
import org.begend.compiler.frontend.parser.ParseError;
import org.begend.compiler.frontend.parser.Parser;
import org.begend.compiler.frontend.parser.ast.NodeIdGenerator;
import org.begend.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;

/**
 * The front-end implementation. This class runs the pipeline from source text to a syntax tree:
 * lexical analysis, then parsing. It is not thread-safe; use one instance per thread.
 * <p>
 * Each call starts with an empty diagnostics list, so one failing source unit never affects
 * the next one.
 */
public class FrontEnd implements IFrontEnd {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final NodeIdMode nodeIdMode;
    private int verbosity = -1;

    /**
     * Creates a front end that numbers the nodes of every parse from 1.
     */
    public FrontEnd() {
        this(NodeIdMode.PER_RUN);
    }

    /**
     * Creates a front end with the given node numbering.
     * @param nodeIdMode How node identifiers are assigned across parses.
     */
    public FrontEnd(NodeIdMode nodeIdMode) {
        this.nodeIdMode = nodeIdMode;
    }

    @Override
    public List<Token> tokenize(List<String> sourceLines, String programName) throws CompilationException {
        applyVerbosity();
        diagnostics.clear();
        return scan(sourceLines, programName);
    }

    @Override
    public ProgramNode parse(List<String> sourceLines, String programName) throws CompilationException {
        applyVerbosity();
        diagnostics.clear();

        // Phase 1: Lexical Analysis
        List<Token> tokens = scan(sourceLines, programName);

        // Phase 2: Parsing
        NodeIdGenerator ids = nodeIdMode == NodeIdMode.PROCESS ? NodeIdGenerator.shared() : new NodeIdGenerator();
        Parser parser = new Parser(tokens, diagnostics, ids);
        try {
            ProgramNode program = parser.parse();
            CompilerLogger.debug(String.format("FrontEnd: parsed %s into %d nodes (%d functions, %d enums, %d statements)",
                    programName, TreeWalker.countNodes(program), program.functions().size(),
                    program.enums().size(), program.statements().size()));
            return program;
        } catch (ParseError e) {
            Token errorToken = e.getErrorToken();
            SourceInfo sourceInfo = new SourceInfo(programName, errorToken.line(), errorToken.column(),
                    lineContent(sourceLines, errorToken.line()));
            CompilerLogger.debug("FrontEnd: syntax error in " + programName + ": " + diagnostics.summary());
            throw new SyntaxException(e.getMessage(), e.getLastToken(), errorToken, sourceInfo, e);
        }
    }

    private List<Token> scan(List<String> sourceLines, String programName) throws CompilationException {
        String fullSource = String.join("\n", sourceLines);
        Lexer lexer = new Lexer(fullSource, diagnostics, programName);
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }
        for (Diagnostic warning : diagnostics.getDiagnostics()) {
            CompilerLogger.warn(warning.toString());
        }
        CompilerLogger.debug(String.format("FrontEnd: scanned %s into %d tokens", programName,
                tokens.stream().filter(t -> t.type() != TokenType.EOF).count()));
        return tokens;
    }

    private static String lineContent(List<String> sourceLines, int line) {
        return line >= 1 && line <= sourceLines.size() ? sourceLines.get(line - 1) : "";
    }

    private void applyVerbosity() {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
    }

    /**
     * Returns the diagnostics of the most recent call.
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
