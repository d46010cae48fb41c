package org.clex.scanner;

import java.util.Objects;

/**
 * A single token committed by one of the recognizers.
 *
 * @param lineNumber The line the scanner was on when recognition started.
 * @param tokenClass The lexical class of the token.
 * @param text The payload of the token (for literals the decoded content, for comments
 *             the content without delimiters).
 * @param error A description of what is malformed about the token, or {@code null}
 *              if it is well formed.
 * @param lexeme The exact source text the recognizer consumed.
 */
public record Token(
        long lineNumber,
        TokenClass tokenClass,
        String text,
        String error,
        String lexeme
) {
    public Token {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("Line numbers start at 1, got " + lineNumber);
        }
        Objects.requireNonNull(tokenClass, "tokenClass");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(lexeme, "lexeme");
    }

    /**
     * Returns the line the token ends on: its start line plus the newline characters
     * inside its lexeme, counted the same way the scanner counts them between tokens.
     *
     * @return The last line the token covers.
     */
    public long endLineNumber() {
        return lineNumber + lexeme.chars().filter(CharClasses::isNewline).count();
    }

    /**
     * @return {@code true} if the token was committed with an error annotation.
     */
    public boolean hasError() {
        return error != null;
    }
}
