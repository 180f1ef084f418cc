package com.example.runbookops.worker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShellWordsTest {

    @Test
    void splitsOnWhitespace() {
        assertEquals(List.of("--namespace", "payments", "-v"), ShellWords.split("  --namespace   payments -v "));
    }

    @Test
    void quotesGroupWords() {
        assertEquals(List.of("--message", "hello world", "it's"),
                ShellWords.split("--message 'hello world' \"it's\""));
    }

    @Test
    void backslashEscapesOutsideQuotes() {
        assertEquals(List.of("a b", "c"), ShellWords.split("a\\ b c"));
    }

    @Test
    void emptyQuotedArgumentIsKept() {
        assertEquals(List.of("--label", ""), ShellWords.split("--label ''"));
    }

    @Test
    void nullOrBlankGivesNoWords() {
        assertTrue(ShellWords.split(null).isEmpty());
        assertTrue(ShellWords.split("   ").isEmpty());
    }

    @Test
    void unterminatedQuoteIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ShellWords.split("--x 'oops"));
    }
}
