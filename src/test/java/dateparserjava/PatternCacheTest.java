package dateparserjava;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PatternCacheTest {

    @Test
    void compilesOncePerExpression() {
        PatternCache cache = new PatternCache();
        assertSame(cache.get("\\d+"), cache.get("\\d+"));
        assertEquals(1, cache.size());
        cache.get("noon");
        assertEquals(2, cache.size());
    }

    @Test
    void matchesCaseInsensitivelyWithUnicodeClasses() {
        PatternCache cache = new PatternCache();
        assertTrue(cache.get("января").matcher("ЯНВАРЯ").matches());
        assertTrue(cache.get("\\w+").matcher("miércoles").matches());
    }

    @Test
    void invalidExpressionIsAConfigurationError() {
        PatternCache cache = new PatternCache();
        assertThrows(LanguageConfigurationException.class, () -> cache.get("(unclosed"));
        assertEquals(0, cache.size());
    }
}
