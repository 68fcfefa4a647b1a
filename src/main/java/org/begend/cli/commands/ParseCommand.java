package org.begend.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.begend.cli.CommandLineInterface;
import org.begend.cli.SourceInput;
import org.begend.cli.rendering.DiagnosticPrinter;
import org.begend.compiler.FrontEnd;
import org.begend.compiler.api.CompilationException;
import org.begend.compiler.frontend.output.PrettyPrintVisitor;
import org.begend.compiler.frontend.output.SyntaxTreeJson;
import org.begend.compiler.frontend.parser.ast.ProgramNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses source files, prints their syntax trees and writes the tree as JSON.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Source files. Without files the built-in demo program is used.")
    private List<Path> files = new ArrayList<>();

    @Option(names = {"-t", "--tokens"}, description = "Also print the tokens of each input.")
    private boolean printTokens;

    @Option(names = {"-o", "--json-out"}, description = "Where to write the JSON tree (default: begend.output.json-file).")
    private Path jsonOut;

    @Option(names = "--no-json", description = "Do not write a JSON file.")
    private boolean noJson;

    @Option(names = "--compact", description = "Write the JSON tree without indentation.")
    private boolean compact;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        final FrontEnd frontEnd;
        final Path jsonTarget;
        final boolean pretty;
        try {
            Config config = parent.getConfig();
            frontEnd = parent.createFrontEnd();
            jsonTarget = jsonOut != null ? jsonOut : Path.of(config.getString("begend.output.json-file"));
            pretty = !compact && config.getBoolean("begend.output.pretty-json");
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
            try {
                if (printTokens) {
                    out.println("=== TOKENS for: " + input.name() + " ===");
                    DiagnosticPrinter.printTokens(out, frontEnd.tokenize(input.lines(), input.name()));
                    out.println();
                }
                ProgramNode program = frontEnd.parse(input.lines(), input.name());
                out.println("=== SYNTAX TREE for: " + input.name() + " ===");
                out.println(PrettyPrintVisitor.render(program));

                if (!noJson) {
                    SyntaxTreeJson.write(program, jsonTarget, pretty);
                    out.println();
                    out.println("=== AST written to " + jsonTarget + " ===");
                }
            } catch (CompilationException e) {
                DiagnosticPrinter.printFailure(err, input.name(), e);
                allSucceeded = false;
            } catch (IOException e) {
                LOG.error("Failed to write JSON tree to {}", jsonTarget, e);
                err.println("Error: cannot write '" + jsonTarget + "' (" + e.getMessage() + ")");
                allSucceeded = false;
            }
            out.println();
        }
        out.flush();
        err.flush();
        return allSucceeded ? 0 : 1;
    }
}
