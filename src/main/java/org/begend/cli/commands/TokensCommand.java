package org.begend.cli.commands;

import com.typesafe.config.ConfigException;
import org.begend.cli.CommandLineInterface;
import org.begend.cli.SourceInput;
import org.begend.cli.rendering.DiagnosticPrinter;
import org.begend.compiler.FrontEnd;
import org.begend.compiler.api.CompilationException;
import org.begend.compiler.frontend.lexer.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Scans source files and prints their tokens.")
public class TokensCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Source files. Without files the built-in demo program is used.")
    private List<Path> files = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        final FrontEnd frontEnd;
        try {
            frontEnd = parent.createFrontEnd();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        boolean allSucceeded = true;
        for (SourceInput input : SourceInput.load(files)) {
            if (!input.isReadable()) {
                err.println("Error: cannot read '" + input.name() + "' (" + input.readError() + ")");
                allSucceeded = false;
                continue;
            }
            out.println("=== TOKENS for: " + input.name() + " ===");
            try {
                List<Token> tokens = frontEnd.tokenize(input.lines(), input.name());
                DiagnosticPrinter.printTokens(out, tokens);
            } catch (CompilationException e) {
                DiagnosticPrinter.printFailure(err, input.name(), e);
                allSucceeded = false;
            }
            out.println();
        }
        out.flush();
        err.flush();
        return allSucceeded ? 0 : 1;
    }
}
