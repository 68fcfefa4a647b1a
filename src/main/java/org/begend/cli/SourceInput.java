package org.begend.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One source unit named on the command line, or the built-in demo program.
 *
 * @param name The name shown in output and diagnostics.
 * @param lines The source lines, or null if the file could not be read.
 * @param readError Why the file could not be read, or null.
 */
public record SourceInput(String name, List<String> lines, String readError) {

    /** The program used when no input file is given. */
    public static final List<String> DEMO_PROGRAM = List.of(
            "int a; real r; bool ok;",
            "5 -> a; 2.5 -> r; true -> ok;",
            "if (a < 10 and not (r >= 2.0)) print(1); else print(0);"
    );

    public boolean isReadable() {
        return readError == null;
    }

    /**
     * Reads the given files. A file that cannot be read yields an input carrying the error,
     * so the remaining files are still processed.
     * @param files The files to read; when empty, the demo program is returned.
     * @return One input per file, in order.
     */
    public static List<SourceInput> load(List<Path> files) {
        if (files.isEmpty()) {
            return List.of(new SourceInput("(inline)", DEMO_PROGRAM, null));
        }
        List<SourceInput> inputs = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                inputs.add(new SourceInput(file.toString(), Files.readAllLines(file, StandardCharsets.UTF_8), null));
            } catch (IOException e) {
                inputs.add(new SourceInput(file.toString(), null, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }
        return inputs;
    }
}
