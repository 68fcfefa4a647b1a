package org.begend.cli.rendering;

import org.begend.compiler.api.CompilationException;
import org.begend.compiler.api.SourceInfo;
import org.begend.compiler.api.SyntaxException;
import org.begend.compiler.frontend.lexer.Token;
import org.begend.compiler.frontend.lexer.TokenType;

import java.io.PrintWriter;
import java.util.List;

/**
 * Formats token listings and front-end failures for the terminal.
 */
public final class DiagnosticPrinter {

    private DiagnosticPrinter() {}

    /**
     * Prints one line per token, {@code TYPE<TAB>'lexeme' @line:col}, followed by the token count.
     * @param out The destination.
     * @param tokens The tokens, EOF included.
     */
    public static void printTokens(PrintWriter out, List<Token> tokens) {
        for (Token token : tokens) {
            out.println(token.type() + "\t'" + token.text() + "' @" + token.line() + ":" + token.column());
        }
        long count = tokens.stream().filter(t -> t.type() != TokenType.EOF).count();
        out.println("Total tokens (without EOF): " + count);
    }

    /**
     * Prints a lexical or syntax failure of one source unit.
     * @param err The destination.
     * @param name The source unit's name.
     * @param e The failure.
     */
    public static void printFailure(PrintWriter err, String name, CompilationException e) {
        if (e instanceof SyntaxException syntax) {
            err.println("Syntax error in '" + name + "': " + syntax.getReason());
            err.println("Last consumed token: " + syntax.getLastToken().describe());
            err.println("Token at error: " + syntax.getErrorToken().describe());
            SourceInfo info = syntax.getSourceInfo();
            if (info != null && !info.lineContent().isEmpty()) {
                err.println("  " + info.lineContent());
                err.println("  " + " ".repeat(Math.max(info.columnNumber() - 1, 0)) + "^");
            }
        } else {
            err.println("Lexical error in '" + name + "':");
            err.println(e.getMessage());
        }
    }
}
