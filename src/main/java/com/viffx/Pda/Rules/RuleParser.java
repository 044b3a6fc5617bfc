package com.viffx.Pda.Rules;

import com.viffx.Pda.Utils.LexicalCharacterBuffer;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.Character.isWhitespace;

/**
 * Turns rule definition text into an ordered list of {@link Transition}s.
 * <p>
 * Every line of the text must read {@code (state,input,stackTop) -> (newState,newStackTop)}.
 * Whitespace around the delimiters is ignored, commas separate the fields of each group and
 * a field is any non-empty run of characters other than {@code ,}, {@code (} and {@code )}.
 * Parsing is all-or-nothing: the first malformed line, including a blank one, aborts it.
 */
public final class RuleParser {
    private RuleParser() {}

    // ====== PUBLIC API ====== //

    /**
     * Parses a rule definition, one rule per line, preserving line order.
     *
     * @param definitionText the raw multi-line rule text
     * @return the transitions in the order they were written
     * @throws RuleFormatException if any line, blank lines included, is malformed
     * @throws NullPointerException if {@code definitionText} is {@code null}
     */
    @NotNull
    @Contract("_ -> new")
    public static List<Transition> parse(String definitionText) throws RuleFormatException {
        Objects.requireNonNull(definitionText, "definitionText cannot be null");

        // keep trailing empty segments, a trailing newline is a blank last line
        String[] lines = definitionText.split("\n", -1);
        List<Transition> transitions = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            transitions.add(parseLine(i + 1, lines[i].strip()));
        }
        return Collections.unmodifiableList(transitions);
    }

    /**
     * Reads and parses a rule file. The final line terminator of the file ends the last
     * rule and is not treated as an extra blank line; any other blank line is still an error.
     *
     * @param path    the rule file
     * @param charset encoding of the file
     * @return the transitions in the order they were written
     * @throws IOException if the file cannot be read
     * @throws RuleFormatException if any line is malformed
     */
    @NotNull
    public static List<Transition> load(Path path, Charset charset) throws IOException, RuleFormatException {
        return parse(read(path, charset));
    }

    /**
     * Reads a rule file as definition text, dropping the final line terminator of the file.
     *
     * @param path    the rule file
     * @param charset encoding of the file
     * @return the definition text, ready for {@link #parse(String)}
     * @throws IOException if the file cannot be read
     */
    @NotNull
    public static String read(Path path, Charset charset) throws IOException {
        String text = Files.readString(path, charset);
        if (text.endsWith("\n")) text = text.substring(0, text.length() - 1);
        return text;
    }

    /**
     * Parses a single, already trimmed, rule line.
     *
     * @param lineNumber 1-based line number used in the error position
     * @param line       the trimmed line
     * @return the transition the line describes
     * @throws RuleFormatException if the line is malformed
     */
    public static Transition parseLine(int lineNumber, String line) throws RuleFormatException {
        try {
            return new LineScanner(lineNumber, line).scan();
        } catch (IOException e) {
            // in-memory readers do not fail
            throw new UncheckedIOException(e);
        }
    }

    // ====== SCANNER ====== //
    private static final class LineScanner {
        private final LexicalCharacterBuffer buffer;
        private final int lineNumber;
        private final String text;

        LineScanner(int lineNumber, String text) throws IOException {
            this.buffer = new LexicalCharacterBuffer(text);
            this.lineNumber = lineNumber;
            this.text = text;
        }

        Transition scan() throws IOException, RuleFormatException {
            skipWhitespace();
            expect('(');
            String state = field();
            expect(',');
            String input = field();
            expect(',');
            String stackTop = field();
            expect(')');

            skipWhitespace();
            expect('-');
            expect('>');
            skipWhitespace();

            expect('(');
            String newState = field();
            expect(',');
            String newStackTop = field();
            expect(')');

            skipWhitespace();
            if (!buffer.eof()) throw error();
            return new Transition(state, input, stackTop, newState, newStackTop);
        }

        // reads up to, not including, the next delimiter and trims the result
        private String field() throws IOException, RuleFormatException {
            StringBuilder builder = new StringBuilder();
            while (!buffer.eof() && !isDelimiter(buffer.crntChar())) {
                char c = buffer.crntChar();
                if (c == '-' && buffer.hasPeek() && buffer.peekChar() == '>') throw error();
                builder.append(c);
                buffer.nextChar();
            }
            String value = builder.toString().strip();
            if (value.isEmpty()) throw error();
            return value;
        }

        private void expect(char expected) throws IOException, RuleFormatException {
            if (buffer.eof() || buffer.crntChar() != expected) throw error();
            buffer.nextChar();
        }

        private void skipWhitespace() throws IOException {
            while (!buffer.eof() && isWhitespace(buffer.crntChar())) {
                buffer.nextChar();
            }
        }

        private RuleFormatException error() {
            return new RuleFormatException(lineNumber, buffer.column(), text);
        }

        private static boolean isDelimiter(char c) {
            return c == ',' || c == '(' || c == ')';
        }
    }
}
