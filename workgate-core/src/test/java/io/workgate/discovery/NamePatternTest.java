package io.workgate.discovery;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamePatternTest {

    @Test
    void emptyOrStarMatchesAll() {
        assertTrue(NamePattern.of(List.of()).matches("anything"));
        assertTrue(NamePattern.of(null).matches("x"));
        assertTrue(NamePattern.of(List.of("*.pdf", "*")).matches("x.txt"));
    }

    @Test
    void wildcardsAndClasses() {
        NamePattern pattern = NamePattern.of(List.of("inv-??.pdf", "scan[0-9].png", "draft[!x].doc"));

        assertTrue(pattern.matches("INV-01.PDF"));
        assertFalse(pattern.matches("inv-001.pdf"));
        assertTrue(pattern.matches("scan7.png"));
        assertFalse(pattern.matches("scanA.png"));
        assertTrue(pattern.matches("drafta.doc"));
        assertFalse(pattern.matches("draftx.doc"));
    }

    @Test
    void regexCharactersAreLiteral() {
        NamePattern pattern = NamePattern.of(List.of("a+b(1).txt"));

        assertTrue(pattern.matches("a+b(1).txt"));
        assertFalse(pattern.matches("aab(1).txt"));
    }

    @Test
    void blankPatternsOnlyMatchAll() {
        assertTrue(NamePattern.of(List.of(" ")).matches("x"));
    }
}
