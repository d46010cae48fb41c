package org.clex.scanner.recognizers;

import org.clex.scanner.TokenClass;

/**
 * Recognizes string constants. Unlike character constants, {@code ""} is legal.
 */
public class StringLiteralRecognizer extends QuotedLiteralRecognizer {

    public StringLiteralRecognizer() {
        super(TokenClass.STRING_LITERAL, '"');
    }

    @Override
    protected String emptyContentError() {
        return null;
    }
}
