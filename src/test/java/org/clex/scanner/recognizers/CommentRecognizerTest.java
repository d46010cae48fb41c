package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.clex.scanner.recognizers.RecognizerTestSupport.assertRejected;
import static org.clex.scanner.recognizers.RecognizerTestSupport.recognize;
import static org.clex.scanner.recognizers.RecognizerTestSupport.rest;

/**
 * Unit tests for the single-line and multi-line comment recognizers.
 */
class CommentRecognizerTest {

    private final SingleLineCommentRecognizer singleLine = new SingleLineCommentRecognizer();
    private final MultiLineCommentRecognizer multiLine = new MultiLineCommentRecognizer();

    /**
     * Verifies that a line comment ends before the newline and leaves it for the driver to count.
     */
    @Test
    @Tag("unit")
    void singleLineCommentStopsBeforeNewline() {
        Cursor cursor = Cursor.of("// A single line comment\nint");

        Token token = recognize(singleLine, cursor);

        assertThat(token.tokenClass()).isEqualTo(TokenClass.SINGLE_LINE_COMMENT);
        assertThat(token.text()).isEqualTo(" A single line comment");
        assertThat(token.lexeme()).isEqualTo("// A single line comment");
        assertThat(token.hasError()).isFalse();
        assertThat(rest(cursor)).isEqualTo("\nint");
    }

    @Test
    @Tag("unit")
    void singleLineCommentAtEndOfInput() {
        Token token = recognize(singleLine, Cursor.of("//"));

        assertThat(token.text()).isEmpty();
    }

    @Test
    @Tag("unit")
    void singleSlashIsNotAComment() {
        assertRejected(singleLine, "/ 2");
        assertRejected(singleLine, "/");
    }

    /**
     * Verifies that a block comment is committed with an empty payload.
     */
    @Test
    @Tag("unit")
    void multiLineCommentHasNoPayload() {
        Cursor cursor = Cursor.of("/* one\n two */x");

        Token token = recognize(multiLine, cursor);

        assertThat(token.tokenClass()).isEqualTo(TokenClass.MULTI_LINE_COMMENT);
        assertThat(token.text()).isEmpty();
        assertThat(token.lexeme()).isEqualTo("/* one\n two */");
        assertThat(rest(cursor)).isEqualTo("x");
    }

    /**
     * Verifies that a run of stars before the slash still closes the comment.
     */
    @Test
    @Tag("unit")
    void starRunBeforeSlashClosesComment() {
        Cursor cursor = Cursor.of("/***/;");

        Token token = recognize(multiLine, cursor);

        assertThat(token.hasError()).isFalse();
        assertThat(rest(cursor)).isEqualTo(";");
    }

    /**
     * Verifies that the star of the opening delimiter cannot also close the comment, so <code>/&#42;/</code> stays open.
     */
    @Test
    @Tag("unit")
    void openingDelimiterCannotCloseComment() {
        Token token = recognize(multiLine, Cursor.of("/*/"));

        assertThat(token.hasError()).isTrue();
    }

    /**
     * Verifies that a block comment still open at the end of input is committed with an error.
     */
    @Test
    @Tag("unit")
    void unterminatedMultiLineCommentIsAnnotated() {
        Cursor cursor = Cursor.of("/* never closed\n");

        Token token = recognize(multiLine, cursor);

        assertThat(token.error()).isEqualTo("missing */");
        assertThat(cursor.peek()).isEqualTo(Cursor.EOF);
    }

    @Test
    @Tag("unit")
    void lineCommentIsNotABlockComment() {
        assertRejected(multiLine, "// x");
    }
}
