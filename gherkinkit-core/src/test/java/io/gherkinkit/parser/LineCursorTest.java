package io.gherkinkit.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineCursorTest {

    @Test
    void testAdvance() {
        LineCursor cursor = new LineCursor("one\n  two  \nthree");
        assertEquals(3, cursor.lineCount());
        assertEquals(1, cursor.currentLineNumber());
        assertEquals("one", cursor.current());
        cursor.advance();
        assertEquals("  two  ", cursor.current());
        assertEquals("two", cursor.peekTrimmed());
        cursor.advance();
        cursor.advance();
        assertTrue(cursor.isAtEnd());
        assertNull(cursor.current());
        assertNull(cursor.peekTrimmed());
        assertEquals(4, cursor.currentLineNumber());
        cursor.advance();
        assertEquals(4, cursor.currentLineNumber());
    }

    @Test
    void testEmptyText() {
        LineCursor cursor = new LineCursor("");
        assertTrue(cursor.isAtEnd());
        assertEquals(1, cursor.currentLineNumber());
        assertTrue(cursor.preview(10).isEmpty());
        assertTrue(new LineCursor(null).isAtEnd());
    }

    @Test
    void testLineTerminators() {
        assertEquals(3, new LineCursor("a\r\nb\rc\n").lineCount());
        assertEquals(2, new LineCursor("a\n\n").lineCount());
        assertEquals(1, new LineCursor("\n").lineCount());
    }

    @Test
    void testPreviewDoesNotConsume() {
        LineCursor cursor = new LineCursor("a\nb\nc\nd");
        cursor.advance();
        assertEquals(List.of("b", "c"), cursor.preview(2));
        assertEquals(List.of("b", "c", "d"), cursor.preview(10));
        assertEquals(2, cursor.currentLineNumber());
        assertEquals("b", cursor.current());
    }

}
