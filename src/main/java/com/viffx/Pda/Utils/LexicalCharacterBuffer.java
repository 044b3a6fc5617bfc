package com.viffx.Pda.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Provides a two-character buffered reader for hand-written scanners, allowing
 * single-character lookahead and controlled advancement through a text stream.
 *
 * <p>The buffer keeps the current and next characters of the stream and counts
 * the 1-based column of the current character, so a scanner can report where it
 * stopped. Subclasses may hook into every advance through {@link #onNextChar()}.
 *
 * <p>EOF (end-of-input) is detected when the current character slot in the buffer
 * contains {@code -1}.
 */
public class LexicalCharacterBuffer {
    // ====== INSTANCE FIELDS ====== //

    /**
     * Reader supplying characters from the source text.
     */
    private final BufferedReader reader;

    /**
     * Holds the current and next character codes from the input stream.
     * <ul>
     *     <li>{@code buffer[0]} - current character</li>
     *     <li>{@code buffer[1]} - next lookahead character</li>
     * </ul>
     */
    private final int[] buffer = new int[2];

    /**
     * Indicates whether the end of the input has been reached
     */
    private boolean eof;

    /**
     * 1-based column of the current character.
     */
    private int column = 1;

    // ====== CONSTRUCTORS ====== //
    /**
     * Wraps the given reader and initializes the two-character buffer.
     *
     * @param source reader supplying the text being scanned
     * @throws IOException if an I/O error occurs while reading the first characters
     */
    public LexicalCharacterBuffer(Reader source) throws IOException {
        reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

        // initialize the buffer
        buffer[0] = reader.read();
        buffer[1] = reader.read();

        // update EOF status
        eof = buffer[0] == -1;
    }

    /**
     * Creates a buffer over an in-memory string.
     *
     * @param text the text being scanned
     * @throws IOException never thrown for in-memory text, declared by the reader contract
     */
    public LexicalCharacterBuffer(String text) throws IOException {
        this(new StringReader(text));
    }

    // ====== PUBLIC API METHODS ====== //
    /**
     * Returns {@code true} if the end of the input has been reached.
     *
     * @return {@code true} if no more characters are available
     */
    public final boolean eof() {
        return eof;
    }

    /**
     * Returns the current character in the buffer.
     *
     * @return the current character
     */
    public final char crntChar() {
        return (char) buffer[0];
    }

    /**
     * Returns the next character in the buffer without advancing it.
     *
     * @return the next character
     */
    public final char peekChar() {
        return (char) buffer[1];
    }

    /**
     * Returns {@code true} if a lookahead character is available.
     *
     * @return {@code true} if {@link #peekChar()} holds a real character
     */
    public final boolean hasPeek() {
        return buffer[1] != -1;
    }

    /**
     * Returns the 1-based column of the current character.
     *
     * @return the column of {@link #crntChar()}
     */
    public final int column() {
        return column;
    }

    /**
     * Advances the buffer by one character, shifting the next lookahead
     * character into the current slot and reading a new lookahead from
     * the underlying reader.
     *
     * <p>Before the shift, this method calls {@link #onNextChar()} to allow
     * subclass-specific behavior.
     *
     * @return the newly current character after advancing
     * @throws IOException if the end of the input has already been reached
     */
    public final char nextChar() throws IOException {
        if (eof) throw new IOException("Reached the end of the input.");

        onNextChar();

        // shift characters
        buffer[0] = buffer[1];
        buffer[1] = reader.read();
        column++;

        // update EOF status
        eof = buffer[0] == -1;

        return crntChar();
    }

    // ====== API HOOKS ====== //
    /**
     * Called immediately before advancing the buffer to the next character.
     */
    public void onNextChar() {}

    // ====== DEBUG INFO ====== //
    /**
     * Returns a human-readable representation of the current buffer contents,
     * useful for debugging scanner behavior.
     *
     * @return a string showing the current and next characters in the buffer
     */
    public String buffer() {
        String[] chars = new String[2];
        for (int i = 0; i < 2; i++) {
            if (buffer[i] == -1) {
                chars[i] = "EOF";
                continue;
            }
            char c = (char) buffer[i];
            chars[i] = switch (c) {
                case '\b' -> "\\b";
                case '\t' -> "\\t";
                case '\n' -> "\\n";
                case '\f' -> "\\f";
                case '\r' -> "\\r";
                default -> String.valueOf(c);
            };
        }
        return String.format("['%s','%s']", chars[0], chars[1]);
    }
}
