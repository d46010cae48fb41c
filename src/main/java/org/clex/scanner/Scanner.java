package org.clex.scanner;

import org.clex.diagnostics.DiagnosticsEngine;
import org.clex.scanner.recognizers.RecognizerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The Scanner converts a stream of characters into a stream of tokens.
 * <p>
 * It alternates between skipping whitespace, which is where line numbers are counted,
 * and handing the cursor to the {@link Dispatcher}. A character no recognizer accepts is
 * consumed, reported as an error and skipped, so every scan terminates.
 */
public class Scanner {

    private static final Logger LOG = LoggerFactory.getLogger(Scanner.class);

    private final Cursor cursor;
    private final Dispatcher dispatcher;
    private final DiagnosticsEngine diagnostics;
    private final ScannerState state;

    /**
     * Creates a scanner with the built-in recognizers.
     * @param cursor The input. The caller stays responsible for closing it.
     * @param diagnostics The engine for reporting lexical errors.
     * @param logicalFileName The name of the input, for diagnostics.
     */
    public Scanner(Cursor cursor, DiagnosticsEngine diagnostics, String logicalFileName) {
        this(cursor, new Dispatcher(RecognizerRegistry.initialize()), diagnostics, logicalFileName);
    }

    /**
     * Creates a scanner with an explicit dispatcher.
     * @param cursor The input. The caller stays responsible for closing it.
     * @param dispatcher The dispatcher that tries the recognizers.
     * @param diagnostics The engine for reporting lexical errors.
     * @param logicalFileName The name of the input, for diagnostics.
     */
    public Scanner(Cursor cursor, Dispatcher dispatcher, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.cursor = cursor;
        this.dispatcher = dispatcher;
        this.diagnostics = diagnostics;
        this.state = new ScannerState(logicalFileName);
    }

    /**
     * Scans the whole input and forwards every token to the sink.
     *
     * @param sink The receiver of the tokens.
     * @return The number of tokens forwarded.
     * @throws ScannerException If the input cannot be read or the sink fails.
     */
    public int scan(TokenSink sink) throws ScannerException {
        int tokenCount = 0;
        try {
            int c;
            while ((c = cursor.peek()) != Cursor.EOF) {
                if (CharClasses.isWhitespace(c)) {
                    cursor.read();
                    if (CharClasses.isNewline(c)) {
                        state.nextLine();
                    }
                    sink.onWhitespace(c);
                    continue;
                }
                Optional<Token> token = dispatcher.dispatch(cursor, state);
                if (token.isPresent()) {
                    sink.accept(token.get());
                    tokenCount++;
                } else {
                    skipUnrecognized(sink);
                }
            }
        } catch (UncheckedIOException e) {
            throw new ScannerException("Failed to read " + state.fileName(), e.getCause());
        } catch (IOException e) {
            throw new ScannerException("Failed to write tokens of " + state.fileName(), e);
        }
        LOG.debug("Scanned {}: {} tokens, {} lines", state.fileName(), tokenCount, state.lineNumber());
        return tokenCount;
    }

    /**
     * Scans the whole input and collects the tokens.
     *
     * @return The tokens in source order.
     * @throws ScannerException If the input cannot be read.
     */
    public List<Token> scanTokens() throws ScannerException {
        List<Token> tokens = new ArrayList<>();
        scan(tokens::add);
        return tokens;
    }

    private void skipUnrecognized(TokenSink sink) {
        int c = cursor.read();
        String message = String.format("unrecognized character '%s' (0x%02X)", CharClasses.encodeEscape(c), c);
        diagnostics.reportError(message, state.fileName(), state.lineNumber());
        LOG.debug("{}:{}: {}", state.fileName(), state.lineNumber(), message);
        sink.onUnrecognized(c, state.lineNumber());
    }
}
