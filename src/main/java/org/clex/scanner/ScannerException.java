package org.clex.scanner;

/**
 * Thrown when a scan cannot continue because the input could not be read or the
 * tokens could not be written. Malformed source text never causes this exception.
 */
public class ScannerException extends Exception {

    /**
     * @param message The detail message.
     */
    public ScannerException(String message) {
        super(message, null);
    }

    /**
     * @param message The detail message.
     * @param cause The underlying I/O failure.
     */
    public ScannerException(String message, Throwable cause) {
        super(message, cause);
    }
}
