package org.clex.scanner.recognizers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered registry of token recognizers. The registration order is the priority
 * order in which the {@link org.clex.scanner.Dispatcher} tries them.
 */
public class RecognizerRegistry {
    private final List<ITokenRecognizer> recognizers = new ArrayList<>();

    /**
     * Appends a recognizer with a lower priority than all recognizers registered so far.
     * @param recognizer The recognizer to add.
     */
    public void register(ITokenRecognizer recognizer) {
        recognizers.add(recognizer);
    }

    /**
     * @return The registered recognizers, highest priority first.
     */
    public List<ITokenRecognizer> getRecognizers() {
        return Collections.unmodifiableList(recognizers);
    }

    /**
     * Creates a registry with the built-in recognizers.
     * <p>
     * Comments and directives go before operators so {@code /} and {@code #} are not
     * taken as operators, reserved words before identifiers, and floats before integers
     * so {@code 3.14} is not split after the {@code 3}.
     *
     * @return A new registry holding all built-in recognizers.
     */
    public static RecognizerRegistry initialize() {
        RecognizerRegistry registry = new RecognizerRegistry();
        registry.register(new SingleLineCommentRecognizer());
        registry.register(new MultiLineCommentRecognizer());
        registry.register(new PreprocessorRecognizer());
        registry.register(new SpecialSymbolRecognizer());
        registry.register(new ReservedWordRecognizer());
        registry.register(new CharLiteralRecognizer());
        registry.register(new StringLiteralRecognizer());
        registry.register(new FloatLiteralRecognizer());
        registry.register(new OperatorRecognizer());
        registry.register(new IdentifierRecognizer());
        registry.register(new IntegerLiteralRecognizer());
        return registry;
    }
}
