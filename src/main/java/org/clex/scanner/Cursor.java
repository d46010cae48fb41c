package org.clex.scanner;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A character source with unbounded pushback.
 * <p>
 * Characters are single bytes (0-255). Characters handed back through {@link #unread(int)}
 * or {@link #unread(CharSequence)} are kept in a deque that is drained before the
 * underlying stream is touched again, so a recognizer can read ahead any number of
 * characters and undo all of them if its match fails.
 * <p>
 * The cursor also records what was consumed since the last {@link #mark()}, which gives
 * recognizers the exact source text of the lexeme they commit.
 * <p>
 * Read failures of the underlying stream are rethrown as {@link UncheckedIOException}.
 */
public class Cursor implements Closeable {

    /** Returned by {@link #peek()} and {@link #read()} at the end of input. */
    public static final int EOF = -1;

    private final InputStream in;
    private final Deque<Integer> pending = new ArrayDeque<>();
    private final StringBuilder captured = new StringBuilder();
    private long position = 0;

    /**
     * Creates a cursor over a byte stream. The cursor takes ownership of the stream.
     * @param in The stream to read from.
     */
    public Cursor(InputStream in) {
        this.in = new BufferedInputStream(in);
    }

    /**
     * Creates a cursor over in-memory source text. Each char of the string must fit in
     * a single byte.
     * @param source The source text.
     * @return A cursor positioned at the start of the text.
     */
    public static Cursor of(String source) {
        return new Cursor(new ByteArrayInputStream(source.getBytes(StandardCharsets.ISO_8859_1)));
    }

    /**
     * Returns the next character without consuming it.
     * @return The next character or {@link #EOF}.
     */
    public int peek() {
        if (pending.isEmpty()) {
            int c = fetch();
            if (c == EOF) {
                return EOF;
            }
            pending.push(c);
        }
        return pending.peek();
    }

    /**
     * Consumes and returns the next character.
     * @return The character or {@link #EOF}.
     */
    public int read() {
        int c = pending.isEmpty() ? fetch() : pending.pop();
        if (c != EOF) {
            position++;
            captured.append((char) c);
        }
        return c;
    }

    /**
     * Consumes up to {@code count} characters. Fewer are returned if the input ends first.
     * @param count The maximum number of characters to read.
     * @return The characters read, possibly empty.
     */
    public String read(int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            int c = read();
            if (c == EOF) {
                break;
            }
            sb.append((char) c);
        }
        return sb.toString();
    }

    /**
     * Pushes one previously read character back. Pushing back {@link #EOF} has no effect.
     * @param c The character to push back.
     */
    public void unread(int c) {
        if (c == EOF) {
            return;
        }
        pending.push(c);
        position--;
        if (captured.length() > 0) {
            captured.setLength(captured.length() - 1);
        }
    }

    /**
     * Pushes a sequence of previously read characters back, so that the following reads
     * return them again in their original order.
     * @param chars The characters to push back, in the order they were read.
     */
    public void unread(CharSequence chars) {
        for (int i = chars.length() - 1; i >= 0; i--) {
            unread(chars.charAt(i));
        }
    }

    /**
     * @return The number of characters consumed so far, net of pushback.
     */
    public long position() {
        return position;
    }

    /**
     * Starts a new capture. {@link #captured()} returns what is consumed from here on.
     */
    public void mark() {
        captured.setLength(0);
    }

    /**
     * @return The characters consumed since the last {@link #mark()}.
     */
    public String captured() {
        return captured.toString();
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private int fetch() {
        try {
            return in.read();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from input", e);
        }
    }
}
