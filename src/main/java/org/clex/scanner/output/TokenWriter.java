package org.clex.scanner.output;

import org.clex.scanner.Token;
import org.clex.scanner.TokenSink;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A {@link TokenSink} that writes one line per token.
 */
public class TokenWriter implements TokenSink, Flushable, Closeable {

    private final Writer writer;
    private final OutputFormat format;

    /**
     * @param writer The destination. The token writer takes ownership of it.
     * @param format The line layout.
     */
    public TokenWriter(Writer writer, OutputFormat format) {
        this.writer = writer;
        this.format = format;
    }

    /**
     * Opens (and truncates) an output file. Characters are written as single bytes,
     * matching the scanner's input model.
     *
     * @param path The output file.
     * @param format The line layout.
     * @return A writer for the file.
     * @throws IOException If the file cannot be opened for writing.
     */
    public static TokenWriter open(Path path, OutputFormat format) throws IOException {
        return new TokenWriter(Files.newBufferedWriter(path, StandardCharsets.ISO_8859_1), format);
    }

    @Override
    public void accept(Token token) throws IOException {
        writer.write(format.format(token));
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
