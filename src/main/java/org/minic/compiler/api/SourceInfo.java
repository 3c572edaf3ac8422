package org.minic.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column, counted in code points.
 * @param lineContent The content of the line.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    /**
     * Formats the position as {@code file:line:column}.
     * @return The formatted location.
     */
    public String location() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
