package org.begend.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code begend} command line in-process and checks its output and exit codes.
 */
@Tag("unit")
class CommandLineInterfaceTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    @Test
    void commandIsNamedBegend() {
        assertThat(commandLine.getCommandName()).isEqualTo("begend");
        assertThat(commandLine.getSubcommands()).containsKeys("tokens", "parse", "help");
    }

    @Test
    void tokensOfDemoProgram() {
        int exitCode = commandLine.execute("tokens");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("=== TOKENS for: (inline) ===")
                .contains("INT\t'int' @1:1")
                .contains("ASSIGN_ARROW\t'->' @2:3")
                .contains("EOF\t'' @3:")
                .contains("Total tokens (without EOF): 45");
    }

    @Test
    void parseDemoProgramWithoutJson() {
        int exitCode = commandLine.execute("parse", "--no-json");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("=== SYNTAX TREE for: (inline) ===")
                .contains("  VarDecl (ID: ")
                .doesNotContain("AST written to");
    }

    @Test
    void parseWritesJsonToRequestedFile(@TempDir Path tempDir) throws Exception {
        Path source = Files.writeString(tempDir.resolve("one.bgd"), "print(1 + 2);");
        Path json = tempDir.resolve("tree.json");

        int exitCode = commandLine.execute("parse", source.toString(), "--json-out", json.toString(), "--compact");

        assertThat(exitCode).isZero();
        assertThat(json).exists();
        assertThat(Files.readString(json)).startsWith("{\"id\":").doesNotContain("\n");
        assertThat(out.toString()).contains("=== AST written to " + json + " ===");
    }

    @Test
    void batchContinuesAfterFailures(@TempDir Path tempDir) throws Exception {
        Path good = Files.writeString(tempDir.resolve("good.bgd"), "int a;");
        Path broken = Files.writeString(tempDir.resolve("broken.bgd"), "int ;");
        Path missing = tempDir.resolve("missing.bgd");
        Path lexBad = Files.writeString(tempDir.resolve("lex.bgd"), "a @ b;");
        Path last = Files.writeString(tempDir.resolve("last.bgd"), "print(2);");

        int exitCode = commandLine.execute("parse", "--no-json",
                good.toString(), broken.toString(), missing.toString(), lexBad.toString(), last.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
                .contains("=== SYNTAX TREE for: " + good + " ===")
                .contains("=== SYNTAX TREE for: " + last + " ===");
        assertThat(err.toString())
                .contains("Syntax error in '" + broken + "': Expected variable name")
                .contains("Last consumed token: INT 'int' @1:1")
                .contains("Token at error: SEMICOLON ';' @1:5")
                .contains("cannot read '" + missing + "'")
                .contains("Lexical error in '" + lexBad + "':")
                .contains("Unexpected character: @");
    }

    @Test
    void parseCanPrintTokensFirst(@TempDir Path tempDir) throws Exception {
        Path source = Files.writeString(tempDir.resolve("t.bgd"), "x;");

        int exitCode = commandLine.execute("parse", "--tokens", "--no-json", source.toString());

        assertThat(exitCode).isZero();
        String text = out.toString();
        assertThat(text.indexOf("=== TOKENS for:")).isLessThan(text.indexOf("=== SYNTAX TREE for:"));
        assertThat(text).contains("Total tokens (without EOF): 2");
    }

    @Test
    void missingConfigFileFails() {
        int exitCode = commandLine.execute("--config", "does-not-exist.conf", "parse", "--no-json");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Error: Configuration file not found");
    }
}
