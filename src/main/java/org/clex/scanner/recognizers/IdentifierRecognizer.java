package org.clex.scanner.recognizers;

import org.clex.scanner.CharClasses;
import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Recognizes identifiers: a letter or underscore followed by letters, digits and
 * underscores.
 */
public class IdentifierRecognizer extends AbstractTokenRecognizer {

    public IdentifierRecognizer() {
        super(TokenClass.IDENTIFIER);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        if (!CharClasses.isIdentifierStart(cursor.peek())) {
            return Optional.empty();
        }
        StringBuilder name = new StringBuilder();
        while (CharClasses.isIdentifierPart(cursor.peek())) {
            name.append((char) cursor.read());
        }
        return commit(cursor, state, name);
    }
}
