package org.clex.scanner.recognizers;

import org.clex.scanner.Cursor;
import org.clex.scanner.Token;
import org.clex.scanner.TokenClass;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.clex.scanner.recognizers.RecognizerTestSupport.assertRejected;
import static org.clex.scanner.recognizers.RecognizerTestSupport.recognize;
import static org.clex.scanner.recognizers.RecognizerTestSupport.rest;

/**
 * Unit tests for the float and integer literal recognizers.
 */
class NumberRecognizerTest {

    private final FloatLiteralRecognizer floats = new FloatLiteralRecognizer();
    private final IntegerLiteralRecognizer integers = new IntegerLiteralRecognizer();

    /**
     * Verifies the accepted float shapes and what each leaves unread.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource({
            "3.14;, 3.14, ;",
            "3.;, 3., ;",
            ".5), .5, )",
            "'-2.5e10 ', -2.5e10, ' '",
            "+1.0E-3x, +1.0E-3, x",
            "6.02e+23, 6.02e+23, ''"
    })
    void recognizesFloat(String source, String expectedText, String expectedRest) {
        Cursor cursor = Cursor.of(source);

        Token token = recognize(floats, cursor);

        assertThat(token.tokenClass()).isEqualTo(TokenClass.FLOAT);
        assertThat(token.text()).isEqualTo(expectedText);
        assertThat(rest(cursor)).isEqualTo(expectedRest);
    }

    /**
     * Verifies that an exponent marker without digits is pushed back and the float ends before it.
     */
    @Test
    @Tag("unit")
    void exponentWithoutDigitsIsPushedBack() {
        Cursor cursor = Cursor.of("3.e");

        Token token = recognize(floats, cursor);

        assertThat(token.text()).isEqualTo("3.");
        assertThat(token.lexeme()).isEqualTo("3.");
        assertThat(rest(cursor)).isEqualTo("e");
    }

    /**
     * Verifies that a signed exponent without digits pushes back both the marker and the sign.
     */
    @Test
    @Tag("unit")
    void signedExponentWithoutDigitsIsPushedBack() {
        Cursor cursor = Cursor.of("1.5e+x");

        assertThat(recognize(floats, cursor).text()).isEqualTo("1.5");
        assertThat(rest(cursor)).isEqualTo("e+x");
    }

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"42", ".", "-.", "+", "abc", "-x", "12e5"})
    void nonFloatsAreRejected(String source) {
        assertRejected(floats, source);
    }

    /**
     * Verifies the accepted decimal, octal and hex integers and what each leaves unread.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource({
            "0;, 0, ;",
            "1234+, 1234, +",
            "0x1Fg, 0x1F, g",
            "0XaB, 0XaB, ''",
            "0177, 0177, ''",
            "09, 0, 9"
    })
    void recognizesInteger(String source, String expectedText, String expectedRest) {
        Cursor cursor = Cursor.of(source);

        Token token = recognize(integers, cursor);

        assertThat(token.tokenClass()).isEqualTo(TokenClass.INTEGER);
        assertThat(token.text()).isEqualTo(expectedText);
        assertThat(rest(cursor)).isEqualTo(expectedRest);
    }

    /**
     * Verifies that {@code 0x} without hex digits commits {@code 0} and leaves the {@code x}.
     */
    @Test
    @Tag("unit")
    void hexPrefixWithoutDigitsCommitsZero() {
        Cursor cursor = Cursor.of("0xg");

        Token token = recognize(integers, cursor);

        assertThat(token.text()).isEqualTo("0");
        assertThat(token.lexeme()).isEqualTo("0");
        assertThat(rest(cursor)).isEqualTo("xg");
    }

    @Test
    @Tag("unit")
    void nonDigitsAreRejectedAsIntegers() {
        assertRejected(integers, "x1");
        assertRejected(integers, "-1");
    }
}
