package org.begend.compiler.api;

/**
 * An exception that is thrown when a source unit cannot be turned into a syntax tree.
 * <p>
 * It is part of the public API and hides the internal exception types of the front end.
 */
public class CompilationException extends Exception {

    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
        this.sourceInfo = null;
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.sourceInfo = null;
    }

    /**
     * Constructs a new compilation exception with the specified detail message, source position and cause.
     * @param message The detail message.
     * @param sourceInfo The source information.
     * @param cause The cause.
     */
    public CompilationException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(String.format("%s at %s", message, sourceInfo), cause);
        this.sourceInfo = sourceInfo;
    }

    /**
     * Returns the source position of the failure, if known.
     * @return The position, or null.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
