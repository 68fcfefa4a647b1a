package org.begend.compiler.api;

/**
 * Selects how syntax-tree node identifiers are numbered.
 */
public enum NodeIdMode {
    /** Every parse numbers its nodes from 1, so the same input always gets the same identifiers. */
    PER_RUN,
    /** All parses in the process share one counter; identifiers are never reused. */
    PROCESS;

    /**
     * Parses a configuration value such as {@code "per-run"} or {@code "PROCESS"}.
     * @param value The configured value.
     * @return The matching mode.
     * @throws IllegalArgumentException if the value names no mode.
     */
    public static NodeIdMode fromConfig(String value) {
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
