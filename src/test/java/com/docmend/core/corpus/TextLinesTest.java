package com.docmend.core.corpus;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextLinesTest {

    @Test
    void trailingNewlineDoesNotAddLine() {
        assertEquals(List.of("a", "b"), TextLines.split("a\nb\n"));
        assertEquals(List.of("a", "b"), TextLines.split("a\nb"));
    }

    @Test
    void keepsCarriageReturns() {
        assertEquals(List.of("a\r", "b\r"), TextLines.split("a\r\nb\r\n"));
    }

    @Test
    void emptyContentHasNoLines() {
        assertTrue(TextLines.split("").isEmpty());
        assertEquals(List.of(""), TextLines.split("\n"));
    }
}
