package org.clex.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the lexical errors found during a scan.
 * <p>
 * The scanner never stops on a lexical error. It records the problem here and keeps
 * going, so the caller decides afterwards what to do with the collected messages.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String fileName, long lineNumber) {
        diagnostics.add(new Diagnostic(message, fileName, lineNumber));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public int errorCount() {
        return diagnostics.size();
    }

    /**
     * @return An unmodifiable view of the reported errors, in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Renders the reported errors one per line, in report order.
     *
     * @return The formatted errors, or an empty string if there are none.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
