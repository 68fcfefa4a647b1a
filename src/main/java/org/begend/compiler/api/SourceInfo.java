package org.begend.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public front-end API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 * @param lineContent The content of the line, or an empty string if unknown.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
