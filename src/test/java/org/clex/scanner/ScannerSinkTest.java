package org.clex.scanner;

import org.clex.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

/**
 * Verifies how the {@link Scanner} talks to its {@link TokenSink}.
 */
@ExtendWith(MockitoExtension.class)
class ScannerSinkTest {

    @Mock
    private TokenSink sink;

    /**
     * Verifies that tokens, skipped whitespace and dropped characters reach the sink in source order.
     */
    @Test
    @Tag("unit")
    void forwardsTokensAndTriviaInSourceOrder() throws Exception {
        new Scanner(Cursor.of("int x;\n@"), new DiagnosticsEngine(), "test.c").scan(sink);

        InOrder order = inOrder(sink);
        order.verify(sink).accept(argThat(t -> t.text().equals("int")));
        order.verify(sink).onWhitespace(' ');
        order.verify(sink).accept(argThat(t -> t.text().equals("x")));
        order.verify(sink).accept(argThat(t -> t.text().equals(";")));
        order.verify(sink).onWhitespace('\n');
        order.verify(sink).onUnrecognized('@', 2);
        verifyNoMoreInteractions(sink);
    }

    /**
     * Verifies that a failing sink stops the scan with a {@link ScannerException}.
     */
    @Test
    @Tag("unit")
    void sinkFailureAbortsScan() throws Exception {
        doThrow(new IOException("disk full")).when(sink).accept(any());
        Scanner scanner = new Scanner(Cursor.of("a b c"), new DiagnosticsEngine(), "test.c");

        assertThatThrownBy(() -> scanner.scan(sink))
                .isInstanceOf(ScannerException.class)
                .hasRootCauseMessage("disk full");
        verify(sink).accept(any());
    }
}
