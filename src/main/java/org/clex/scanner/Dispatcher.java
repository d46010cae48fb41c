package org.clex.scanner;

import org.clex.scanner.recognizers.ITokenRecognizer;
import org.clex.scanner.recognizers.RecognizerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Tries the registered recognizers in priority order and returns the first token any
 * of them commits.
 */
public class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final List<ITokenRecognizer> recognizers;

    /**
     * @param registry The recognizers to try, in the registry's order.
     */
    public Dispatcher(RecognizerRegistry registry) {
        this.recognizers = registry.getRecognizers();
    }

    /**
     * Attempts to recognize one token at the cursor.
     *
     * @param cursor The input.
     * @param state The running scan's state.
     * @return The committed token, or empty if no recognizer matched. In the latter
     *         case the cursor has not moved.
     */
    public Optional<Token> dispatch(Cursor cursor, ScannerState state) {
        for (ITokenRecognizer recognizer : recognizers) {
            Optional<Token> token = recognizer.recognize(cursor, state);
            if (token.isPresent()) {
                if (LOG.isTraceEnabled()) {
                    LOG.trace("{}:{}: {} committed '{}'", state.fileName(), state.lineNumber(),
                            recognizer.getClass().getSimpleName(), token.get().lexeme());
                }
                return token;
            }
        }
        return Optional.empty();
    }
}
