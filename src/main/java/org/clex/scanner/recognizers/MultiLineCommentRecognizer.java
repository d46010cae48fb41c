package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Recognizes block comments. The token has no payload. A comment still open at the end
 * of input is committed with an error so the scan can finish normally.
 */
public class MultiLineCommentRecognizer extends AbstractTokenRecognizer {

    private static final String OPENING = "/*";

    public MultiLineCommentRecognizer() {
        super(TokenClass.MULTI_LINE_COMMENT);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        if (!consumeExactly(cursor, OPENING)) {
            return Optional.empty();
        }
        int c;
        while ((c = cursor.read()) != Cursor.EOF) {
            if (c == '*' && cursor.peek() == '/') {
                cursor.read();
                return commit(cursor, state, "");
            }
        }
        return commitWithError(cursor, state, "", "missing */");
    }
}
