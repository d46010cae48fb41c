package org.clex.scanner.recognizers;

import org.clex.scanner.TokenClass;

/**
 * Recognizes character constants such as {@code 'a'} or {@code '\n'}.
 */
public class CharLiteralRecognizer extends QuotedLiteralRecognizer {

    public CharLiteralRecognizer() {
        super(TokenClass.CHAR_LITERAL, '\'');
    }

    @Override
    protected String emptyContentError() {
        return "empty character constant";
    }
}
