package dateparserjava;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class SimplificationTest {

    @Test
    void parsesGroupReferences() {
        assertEquals(Arrays.asList(1, ":", 2), Simplification.parseTemplate("\\1:\\2"));
        assertEquals(Arrays.asList("x", 12, "y"), Simplification.parseTemplate("x\\g<12>y"));
        assertEquals(Arrays.asList("a\\b"), Simplification.parseTemplate("a\\\\b"));
    }

    @Test
    void rejectsMalformedGroupReferences() {
        assertThrows(LanguageConfigurationException.class, () -> Simplification.parseTemplate("\\g<1"));
        assertThrows(LanguageConfigurationException.class, () -> Simplification.parseTemplate("\\g<name>"));
    }

    @Test
    void integerReplacementIsRenderedAsText() {
        assertEquals("1", new Simplification("an", 1).getReplacement());
    }

    @Test
    void appliesRawPattern() {
        Simplification rule = new Simplification("(\\d+)h(\\d+)", "\\1:\\2");
        assertEquals("10:30", rule.apply("10h30", PatternCache.compile(rule.getPattern()), false));
    }

    @Test
    void wrappedPatternKeepsBoundariesAndShiftsGroups() {
        Simplification rule = new Simplification("(\\d+)h(\\d+)", "\\1:\\2");
        Pattern wrapped = PatternCache.compile(rule.wrappedPattern());
        assertEquals("at 10:30 today", rule.apply("at 10h30 today", wrapped, true));
        assertEquals("10:30", rule.apply("10h30", wrapped, true));
    }

    @Test
    void wrappedPatternDoesNotMatchInsideWords() {
        Simplification rule = new Simplification("a", 1);
        Pattern wrapped = PatternCache.compile(rule.wrappedPattern());
        assertEquals("today", rule.apply("today", wrapped, true));
        assertEquals("1 day ago", rule.apply("a day ago", wrapped, true));
    }

    @Test
    void unmatchedTextIsReturnedUnchanged() {
        Simplification rule = new Simplification("noon", "12:00");
        assertEquals("midnight", rule.apply("midnight", PatternCache.compile("noon"), false));
    }

    @Test
    void missingGroupIsAConfigurationError() {
        Simplification rule = new Simplification("an", "\\2");
        assertThrows(LanguageConfigurationException.class,
                () -> rule.apply("an", PatternCache.compile("an"), false));
    }

    @Test
    void replacementIsLiteralText() {
        Simplification rule = new Simplification("x", "$1");
        assertEquals("$1", rule.apply("x", PatternCache.compile("x"), false));
    }

    @Test
    void normalizedRuleFoldsAccents() {
        Simplification rule = new Simplification("mediodía", "12:00").normalized();
        assertEquals("mediodia", rule.getPattern());
        assertEquals("12:00", rule.getReplacement());
    }
}
