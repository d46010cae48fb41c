package org.clex.diagnostics;

/**
 * A lexical error reported while scanning a source file.
 *
 * @param message The human readable description.
 * @param fileName The logical name of the scanned source.
 * @param lineNumber The line the scanner was on when the problem was found.
 */
public record Diagnostic(
        String message,
        String fileName,
        long lineNumber
) {
    @Override
    public String toString() {
        return String.format("[ERROR] %s:%d: %s", fileName, lineNumber, message);
    }
}
