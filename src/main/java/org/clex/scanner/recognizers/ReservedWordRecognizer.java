package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes reserved words by reading exactly as many characters as each keyword has
 * and comparing them, in table order.
 * <p>
 * The character after the keyword is not inspected, so an identifier that starts with
 * a keyword is split: {@code iffy} becomes {@code if} followed by the identifier
 * {@code fy}, and {@code double} matches {@code do} first.
 */
public class ReservedWordRecognizer extends AbstractTokenRecognizer {

    /** The keywords in the order they are tried. */
    public static final List<String> RESERVED_WORDS = List.of(
            "if", "else", "while", "for", "do", "switch", "case", "default",
            "continue", "int", "float", "double", "char", "break", "static",
            "extern", "auto", "register", "sizeof", "union", "struct", "enum",
            "return", "goto", "const"
    );

    public ReservedWordRecognizer() {
        super(TokenClass.RESERVED_WORD);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        for (String word : RESERVED_WORDS) {
            if (consumeExactly(cursor, word)) {
                return commit(cursor, state, word);
            }
        }
        return Optional.empty();
    }
}
