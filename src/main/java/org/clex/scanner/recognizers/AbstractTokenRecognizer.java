package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Common plumbing for recognizers: marks the cursor on entry so the committed token
 * carries the exact lexeme, and builds tokens for the subclass's class.
 */
public abstract class AbstractTokenRecognizer implements ITokenRecognizer {

    private final TokenClass tokenClass;

    protected AbstractTokenRecognizer(TokenClass tokenClass) {
        this.tokenClass = tokenClass;
    }

    @Override
    public TokenClass getTokenClass() {
        return tokenClass;
    }

    @Override
    public final Optional<Token> recognize(Cursor cursor, ScannerState state) {
        cursor.mark();
        return scan(cursor, state);
    }

    /**
     * Performs the actual recognition. Implementations must either commit through
     * {@link #commit} / {@link #commitWithError} or restore the cursor and return empty.
     */
    protected abstract Optional<Token> scan(Cursor cursor, ScannerState state);

    protected Optional<Token> commit(Cursor cursor, ScannerState state, CharSequence text) {
        return Optional.of(new Token(state.lineNumber(), tokenClass, text.toString(), null, cursor.captured()));
    }

    protected Optional<Token> commitWithError(Cursor cursor, ScannerState state, CharSequence text, String error) {
        return Optional.of(new Token(state.lineNumber(), tokenClass, text.toString(), error, cursor.captured()));
    }

    /**
     * Reads the next {@code expected.length()} characters and keeps them if they match.
     * On a mismatch everything read is pushed back.
     *
     * @return {@code true} if the input started with {@code expected}.
     */
    protected static boolean consumeExactly(Cursor cursor, String expected) {
        String actual = cursor.read(expected.length());
        if (expected.equals(actual)) {
            return true;
        }
        cursor.unread(actual);
        return false;
    }
}
