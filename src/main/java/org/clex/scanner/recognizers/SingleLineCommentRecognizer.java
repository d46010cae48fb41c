package org.clex.scanner.recognizers;

import org.clex.scanner.CharClasses;
import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Recognizes {@code // ...} comments. The payload is everything after the delimiter up
 * to the end of the line; the newline itself stays in the input.
 */
public class SingleLineCommentRecognizer extends AbstractTokenRecognizer {

    private static final String DELIMITER = "//";

    public SingleLineCommentRecognizer() {
        super(TokenClass.SINGLE_LINE_COMMENT);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        if (!consumeExactly(cursor, DELIMITER)) {
            return Optional.empty();
        }
        StringBuilder content = new StringBuilder();
        int c;
        while ((c = cursor.read()) != Cursor.EOF && !CharClasses.isNewline(c)) {
            content.append((char) c);
        }
        cursor.unread(c);
        return commit(cursor, state, content);
    }
}
