package org.clex.scanner;

/**
 * Mutable state threaded through one scan: the logical file name and the current line.
 * <p>
 * The line counter only moves forward. It is advanced by the driver loop for every
 * newline character it skips between tokens; a carriage return followed by a line feed
 * therefore advances it twice.
 */
public class ScannerState {

    private final String fileName;
    private long lineNumber = 1;

    public ScannerState(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    public long lineNumber() {
        return lineNumber;
    }

    void nextLine() {
        lineNumber++;
    }
}
