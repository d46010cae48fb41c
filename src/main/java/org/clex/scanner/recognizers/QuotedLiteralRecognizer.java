package org.clex.scanner.recognizers;

import org.clex.scanner.CharClasses;
import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Shared scanning for quoted literals. The payload is the decoded content between the
 * quotes. A backslash directly before a newline continues the literal on the next
 * line and the leading whitespace of that line is dropped.
 * <p>
 * A literal that reaches a newline or the end of input before its closing quote is
 * committed with an error and the newline is left in the input.
 */
abstract class QuotedLiteralRecognizer extends AbstractTokenRecognizer {

    private final char quote;

    protected QuotedLiteralRecognizer(TokenClass tokenClass, char quote) {
        super(tokenClass);
        this.quote = quote;
    }

    /**
     * @return An error for an empty literal, or {@code null} if empty literals are allowed.
     */
    protected abstract String emptyContentError();

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        int c = cursor.read();
        if (c != quote) {
            cursor.unread(c);
            return Optional.empty();
        }
        String missingClose = "missing closing " + quote;
        StringBuilder content = new StringBuilder();
        while (true) {
            c = cursor.read();
            if (c == quote) {
                break;
            }
            if (c == Cursor.EOF || CharClasses.isNewline(c)) {
                cursor.unread(c);
                return commitWithError(cursor, state, content, missingClose);
            }
            if (c != '\\') {
                content.append((char) c);
                continue;
            }
            int escaped = cursor.read();
            if (escaped == Cursor.EOF) {
                return commitWithError(cursor, state, content, missingClose);
            }
            if (CharClasses.isNewline(escaped)) {
                while (CharClasses.isWhitespace(cursor.peek())) {
                    cursor.read();
                }
                continue;
            }
            content.append((char) CharClasses.decodeEscape(escaped));
        }

        String emptyError = emptyContentError();
        if (content.length() == 0 && emptyError != null) {
            return commitWithError(cursor, state, content, emptyError);
        }
        return commit(cursor, state, content);
    }
}
