package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes operators. Two-character operators come first in the table so they win
 * over their one-character prefixes.
 */
public class OperatorRecognizer extends AbstractTokenRecognizer {

    /** The operators in the order they are tried. */
    public static final List<String> OPERATORS = List.of(
            ">>", "<<", "++", "--", "+=", "-=", "*=", "/=", "%=", "&&", "||",
            "->", "==", ">=", "<=", "!=",
            "+", "-", "*", "/", "=", ",", "%", "!", "&", "[", "]", "|", "^",
            ".", ">", "<", ":", "?"
    );

    public OperatorRecognizer() {
        super(TokenClass.OPERATOR);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        for (String operator : OPERATORS) {
            if (consumeExactly(cursor, operator)) {
                return commit(cursor, state, operator);
            }
        }
        return Optional.empty();
    }
}
