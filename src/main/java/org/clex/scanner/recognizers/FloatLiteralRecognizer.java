package org.clex.scanner.recognizers;

import org.clex.scanner.CharClasses;
import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Recognizes floating-point constants:
 * <pre>
 *   [+|-]? ( D+ '.' D* | D* '.' D+ ) [ (E|e) [+|-]? D+ ]
 * </pre>
 * A digit run without a following dot is left for the integer recognizer. An exponent
 * marker that is not followed by a digit is not part of the constant.
 */
public class FloatLiteralRecognizer extends AbstractTokenRecognizer {

    public FloatLiteralRecognizer() {
        super(TokenClass.FLOAT);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        StringBuilder mantissa = new StringBuilder();
        readSign(cursor, mantissa);
        int integerDigits = readDigits(cursor, mantissa);
        if (cursor.peek() != '.') {
            cursor.unread(mantissa);
            return Optional.empty();
        }
        mantissa.append((char) cursor.read());
        int fractionDigits = readDigits(cursor, mantissa);
        if (integerDigits == 0 && fractionDigits == 0) {
            cursor.unread(mantissa);
            return Optional.empty();
        }

        int marker = cursor.peek();
        if (marker == 'e' || marker == 'E') {
            StringBuilder exponent = new StringBuilder();
            exponent.append((char) cursor.read());
            readSign(cursor, exponent);
            if (readDigits(cursor, exponent) == 0) {
                cursor.unread(exponent);
            } else {
                mantissa.append(exponent);
            }
        }
        return commit(cursor, state, mantissa);
    }

    private static void readSign(Cursor cursor, StringBuilder into) {
        int c = cursor.peek();
        if (c == '+' || c == '-') {
            into.append((char) cursor.read());
        }
    }

    private static int readDigits(Cursor cursor, StringBuilder into) {
        int count = 0;
        while (CharClasses.isDigit(cursor.peek())) {
            into.append((char) cursor.read());
            count++;
        }
        return count;
    }
}
