package org.clex.scanner.output;

import org.clex.scanner.CharClasses;
import org.clex.scanner.Token;

/**
 * The line layouts the {@link TokenWriter} can produce.
 */
public enum OutputFormat {
    /** {@code <CLASS>: <payload>} */
    PLAIN {
        @Override
        public String format(Token token) {
            return token.tokenClass().code() + ": " + payload(token) + "\n";
        }
    },
    /**
     * {@code <line>\t<CLASS>\t<payload>}. A token spanning several lines is given as
     * {@code <first>-<last>}; the payload column is left out when the payload is empty.
     */
    TABULAR {
        @Override
        public String format(Token token) {
            StringBuilder line = new StringBuilder();
            line.append(token.lineNumber());
            long endLine = token.endLineNumber();
            if (endLine != token.lineNumber()) {
                line.append('-').append(endLine);
            }
            line.append('\t').append(token.tokenClass().code());
            String payload = payload(token);
            if (!payload.isEmpty()) {
                line.append('\t').append(payload);
            }
            return line.append('\n').toString();
        }
    };

    /**
     * Renders one token as a single output line, including the line terminator.
     * @param token The token.
     * @return The rendered line.
     */
    public abstract String format(Token token);

    /**
     * Returns the printable payload of a token: its text with control characters
     * escaped, followed by {@code ERROR: <description>} for error-annotated tokens.
     * @param token The token.
     * @return The payload.
     */
    public static String payload(Token token) {
        StringBuilder sb = new StringBuilder();
        token.text().chars().forEach(c -> sb.append(CharClasses.encodeEscape(c)));
        if (token.hasError()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append("ERROR: ").append(token.error());
        }
        return sb.toString();
    }
}
