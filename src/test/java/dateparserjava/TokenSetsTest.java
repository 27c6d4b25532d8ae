package dateparserjava;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenSetsTest {

    @Test
    void commaLikeTokens() {
        assertTrue(TokenSets.isCommaLike(","));
        assertTrue(TokenSets.isCommaLike("，"));
        assertTrue(TokenSets.isCommaLike("、"));
        assertFalse(TokenSets.isCommaLike(":"));
        assertFalse(TokenSets.isCommaLike(",,"));
        assertFalse(TokenSets.isCommaLike(null));
    }

    @Test
    void stripsGivenCharacters() {
        assertEquals("monday", TokenSets.strip("(monday),", TokenSets.SEARCH_STRIP_CHARS));
        assertEquals("", TokenSets.strip("()", TokenSets.SEARCH_STRIP_CHARS));
        assertEquals("10.5", TokenSets.strip("10.5", "()"));
    }

    @Test
    void digitTokens() {
        assertTrue(TokenSets.isDigits("2015"));
        assertTrue(TokenSets.isDigits("٢٠١٥"));
        assertFalse(TokenSets.isDigits("10:30"));
        assertFalse(TokenSets.isDigits(""));
    }

    @Test
    void alwaysKeptTokensIncludePlus() {
        assertEquals("+", TokenSets.ALWAYS_KEEP_TOKENS.get(0));
        assertTrue(TokenSets.ALWAYS_KEEP_TOKENS.containsAll(TokenSets.PARSER_HARDCODED_TOKENS));
        assertEquals(31, TokenSets.KNOWN_WORD_TOKENS.size());
    }
}
