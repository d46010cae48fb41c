package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Recognizes the single-character punctuation symbols.
 */
public class SpecialSymbolRecognizer extends AbstractTokenRecognizer {

    static final String SYMBOLS = "{}();";

    public SpecialSymbolRecognizer() {
        super(TokenClass.SPECIAL_SYMBOL);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        int c = cursor.peek();
        if (c == Cursor.EOF || SYMBOLS.indexOf(c) < 0) {
            return Optional.empty();
        }
        cursor.read();
        return commit(cursor, state, String.valueOf((char) c));
    }
}
