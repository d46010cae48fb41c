package org.clex.scanner;

import java.io.IOException;

/**
 * Receives the output of a {@link Scanner}, in source order.
 */
@FunctionalInterface
public interface TokenSink {

    /**
     * Called for every committed token.
     * @param token The token.
     * @throws IOException If the token cannot be stored or written.
     */
    void accept(Token token) throws IOException;

    /**
     * Called for every whitespace character skipped between tokens.
     * @param c The skipped character.
     */
    default void onWhitespace(int c) {
        // Most sinks only care about tokens.
    }

    /**
     * Called when a character matched no recognizer and was dropped.
     * @param c The dropped character.
     * @param lineNumber The line it was found on.
     */
    default void onUnrecognized(int c, long lineNumber) {
        // Reported through the diagnostics engine already.
    }
}
