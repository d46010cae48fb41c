package org.clex.scanner.recognizers;

import org.clex.scanner.CharClasses;
import org.clex.scanner.Cursor;
import org.clex.scanner.ScannerState;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;

import java.util.Optional;

/**
 * Recognizes {@code #include <file>} and {@code #include "file"} directives.
 * <p>
 * A {@code #} that is not followed by the word {@code include} is not a directive and
 * the recognizer fails. Once {@code include} has been seen the directive is committed
 * no matter what follows; anything wrong with the rest of it goes into the token's
 * error. The payload is the directive as written, without the trailing newline.
 */
public class PreprocessorRecognizer extends AbstractTokenRecognizer {

    private static final String DIRECTIVE = "include";

    public PreprocessorRecognizer() {
        super(TokenClass.PREPROCESSOR);
    }

    @Override
    protected Optional<Token> scan(Cursor cursor, ScannerState state) {
        int c = cursor.read();
        if (c != '#') {
            cursor.unread(c);
            return Optional.empty();
        }
        StringBuilder consumed = new StringBuilder("#");
        skipBlanks(cursor, consumed);
        String word = cursor.read(DIRECTIVE.length());
        consumed.append(word);
        if (!DIRECTIVE.equals(word)) {
            cursor.unread(consumed);
            return Optional.empty();
        }

        if (CharClasses.isIdentifierPart(cursor.peek())) {
            while (CharClasses.isIdentifierPart(cursor.peek())) {
                cursor.read();
            }
            return commitWithError(cursor, state, cursor.captured(), "unknown directive");
        }

        skipBlanks(cursor, null);
        int opening = cursor.read();
        int closing = closingDelimiterFor(opening);
        if (closing == Cursor.EOF) {
            cursor.unread(opening);
            return commitWithError(cursor, state, cursor.captured().stripTrailing(), "expected < or \" after #include");
        }

        while (true) {
            c = cursor.read();
            if (c == closing) {
                return commit(cursor, state, cursor.captured());
            }
            if (c == Cursor.EOF || CharClasses.isNewline(c)) {
                cursor.unread(c);
                return commitWithError(cursor, state, cursor.captured(), "missing closing " + (char) closing);
            }
        }
    }

    private static int closingDelimiterFor(int opening) {
        return switch (opening) {
            case '<' -> '>';
            case '"' -> '"';
            default -> Cursor.EOF;
        };
    }

    private static void skipBlanks(Cursor cursor, StringBuilder consumed) {
        while (CharClasses.isBlank(cursor.peek())) {
            int c = cursor.read();
            if (consumed != null) {
                consumed.append((char) c);
            }
        }
    }
}
