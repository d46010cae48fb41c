package org.clex.scanner.recognizers;

import org.clex.scanner.CharClasses;
import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Recognizes integer constants in decimal, octal ({@code 017}) and hexadecimal
 * ({@code 0x1F}) notation.
 * <p>
 * A leading zero only continues with octal digits, so {@code 09} is two constants.
 * {@code 0x} without a hex digit is the constant {@code 0}; the {@code x} stays in
 * the input.
 */
public class IntegerLiteralRecognizer extends AbstractTokenRecognizer {

    public IntegerLiteralRecognizer() {
        super(TokenClass.INTEGER);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        int first = cursor.peek();
        if (!CharClasses.isDigit(first)) {
            return Optional.empty();
        }
        StringBuilder literal = new StringBuilder();
        literal.append((char) cursor.read());
        if (first != '0') {
            readWhile(cursor, literal, CharClasses::isDigit);
            return commit(cursor, state, literal);
        }

        int radixMarker = cursor.peek();
        if (radixMarker == 'x' || radixMarker == 'X') {
            cursor.read();
            StringBuilder hexDigits = new StringBuilder();
            if (readWhile(cursor, hexDigits, CharClasses::isHexDigit) == 0) {
                cursor.unread(radixMarker);
                return commit(cursor, state, literal);
            }
            literal.append((char) radixMarker).append(hexDigits);
            return commit(cursor, state, literal);
        }

        readWhile(cursor, literal, CharClasses::isOctalDigit);
        return commit(cursor, state, literal);
    }

    private static int readWhile(Cursor cursor, StringBuilder into, IntPredicate accept) {
        int count = 0;
        while (accept.test(cursor.peek())) {
            into.append((char) cursor.read());
            count++;
        }
        return count;
    }
}
