package com.viffx.Pda.Utils;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class LexicalCharacterBufferTest {
    @Test
    void walksTheTextWithOneCharacterLookahead() throws IOException {
        LexicalCharacterBuffer buffer = new LexicalCharacterBuffer("ab");

        assertFalse(buffer.eof());
        assertEquals('a', buffer.crntChar());
        assertEquals('b', buffer.peekChar());
        assertEquals(1, buffer.column());

        assertEquals('b', buffer.nextChar());
        assertFalse(buffer.hasPeek());
        assertEquals(2, buffer.column());

        buffer.nextChar();
        assertTrue(buffer.eof());
        assertThrows(IOException.class, buffer::nextChar);
    }

    @Test
    void emptyTextStartsAtEof() throws IOException {
        assertTrue(new LexicalCharacterBuffer("").eof());
    }

    @Test
    void hookRunsOnEveryAdvance() throws IOException {
        int[] calls = {0};
        LexicalCharacterBuffer buffer = new LexicalCharacterBuffer("xyz") {
            @Override
            public void onNextChar() {
                calls[0]++;
            }
        };
        buffer.nextChar();
        buffer.nextChar();

        assertEquals(2, calls[0]);
    }

    @Test
    void debugViewEscapesControlCharacters() throws IOException {
        assertEquals("['\\t','a']", new LexicalCharacterBuffer("\ta").buffer());
        assertEquals("['a','EOF']", new LexicalCharacterBuffer("a").buffer());
    }
}
