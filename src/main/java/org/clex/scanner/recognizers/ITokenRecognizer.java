package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * The base interface for all token recognizers.
 * Each recognizer is responsible for exactly one {@link TokenClass}.
 */
public interface ITokenRecognizer {

    /**
     * @return The class of the tokens this recognizer commits.
     */
    TokenClass getTokenClass();

    /**
     * Tries to recognize a token at the current cursor position.
     * <p>
     * On success the cursor is left right after the consumed lexeme. On failure the
     * cursor is back at the position it had on entry.
     *
     * @param cursor The shared character source.
     * @param state The state of the running scan, used for the line number.
     * @return The committed token, or empty if the input does not start with a lexeme
     *         of this class.
     */
    Optional<Token> recognize(Cursor cursor, ScannerState state);
}
