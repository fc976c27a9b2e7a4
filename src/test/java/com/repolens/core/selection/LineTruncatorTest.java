package com.repolens.core.selection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineTruncatorTest {

    @Test
    @DisplayName("cuts at the last line boundary within the limit")
    void truncate() {
        assertEquals("a\nbb\n", LineTruncator.truncate("a\nbb\nccc\n", 5));
        assertEquals("a\nbb\nccc\n", LineTruncator.truncate("a\nbb\nccc\n", 100));
    }

    @Test
    @DisplayName("returns empty when not even the first line fits")
    void firstLineTooLong() {
        assertEquals("", LineTruncator.truncate("abcdef\nxy\n", 3));
        assertEquals("", LineTruncator.truncate("abcdef", 0));
    }

    @Test
    @DisplayName("cuts to whole lines that fit a token allowance")
    void truncateToTokens() {
        String text = "line one\nline two\nline three\n";
        assertEquals("line one\n", LineTruncator.truncateToTokens(text, 3));
        assertEquals(text, LineTruncator.truncateToTokens(text, 100));
        assertEquals("", LineTruncator.truncateToTokens(text, 1));
    }
}
