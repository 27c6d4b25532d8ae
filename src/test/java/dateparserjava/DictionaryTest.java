package dateparserjava;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class DictionaryTest {

    private static LanguageInfo fixture() {
        return LanguageInfo.builder("test")
                .skip("and")
                .pertain("of")
                .words("monday", "monday", "mon")
                .words("day", "day", "days")
                .relativeType("2 day ago", "day before yesterday")
                .build();
    }

    @Test
    void mapsFormsToCanonicalWords() {
        Dictionary dict = Dictionary.of(fixture(), Settings.defaults());
        assertTrue(dict.contains("MONDAY"));
        assertEquals("monday", dict.translate("Mon"));
        assertEquals("", dict.translate("and"));
        assertEquals("", dict.translate("of"));
        assertNull(dict.translate("tuesday"));
        assertEquals("2 day ago", dict.translate("day before yesterday"));
    }

    @Test
    void includesParserTokensAndSkipTokens() {
        Dictionary dict = Dictionary.of(fixture(), Settings.defaults());
        assertEquals("UTC", dict.translate("utc"));
        assertEquals(":", dict.translate(":"));
        assertEquals("", dict.translate("t"));
        assertTrue(dict.words().contains("t"));

        Dictionary custom = Dictionary.of(fixture(), Settings.defaults().withSkipTokens(Arrays.asList("Monday")));
        assertEquals("", custom.translate("monday"));
        assertFalse(custom.contains("t"));
    }

    @Test
    void splitPrefersLongestPhrase() {
        Dictionary dict = Dictionary.of(fixture(), Settings.defaults());
        assertEquals(Arrays.asList("day before yesterday", " ", "monday"),
                dict.split("day before yesterday monday", false));
    }

    @Test
    void splitRespectsWordBoundaries() {
        Dictionary dict = Dictionary.of(fixture(), Settings.defaults());
        assertEquals(Collections.singletonList("mondays"), dict.split("mondays", false));
        assertEquals(Arrays.asList("10", "days"), dict.split("10days", false));
    }

    @Test
    void splitDropsPunctuationUnlessFormattingIsKept() {
        Dictionary dict = Dictionary.of(fixture(), Settings.defaults());
        assertEquals(Arrays.asList("monday", " ", "5"), dict.split("monday; 5", false));
        assertEquals(Arrays.asList("monday", ";", " ", "5"), dict.split("monday; 5", true));
        assertTrue(dict.split("", false).isEmpty());
    }

    @Test
    void splitDigitRuns() {
        assertEquals(Arrays.asList("2015", "年", "3", "月"), Dictionary.splitDigitRuns("2015年3月"));
        assertEquals(Collections.singletonList("abc"), Dictionary.splitDigitRuns("abc"));
        assertTrue(Dictionary.splitDigitRuns("").isEmpty());
    }

    @Test
    void normalizedKeysAreFolded() {
        LanguageInfo info = LanguageInfo.builder("es")
                .words("wednesday", "miércoles")
                .build();
        Dictionary dict = Dictionary.normalized(info, Settings.normalized());
        assertEquals("wednesday", dict.translate("miercoles"));
        assertFalse(dict.contains("miércoles"));
    }

    @Test
    void normalizedKeepsExistingPlainKey() {
        LanguageInfo info = LanguageInfo.builder("test")
                .words("january", "ano")
                .words("year", "año")
                .build();
        Dictionary dict = Dictionary.normalized(info, Settings.normalized());
        assertEquals("january", dict.translate("ano"));
    }

    @Test
    void normalizedLetsSkipWordsWin() {
        LanguageInfo info = LanguageInfo.builder("test")
                .skip("à")
                .words("in", "a")
                .build();
        assertEquals("in", Dictionary.of(info, Settings.defaults()).translate("a"));
        assertEquals("", Dictionary.normalized(info, Settings.normalized()).translate("a"));
    }

    @Test
    void noWordSpacingMatchesInsideText() {
        LanguageInfo info = LanguageInfo.builder("zh")
                .noWordSpacing(true)
                .words("year", "年")
                .relativeType("in 1 day", "明天")
                .build();
        Dictionary dict = Dictionary.of(info, Settings.defaults());
        assertEquals(Arrays.asList("我们", "明天", "见"), dict.split("我们明天见", true));
        assertEquals(Collections.singletonList("明天"), dict.split("我们明天见", false).subList(1, 2));
    }

    @Test
    void tracksKeyLengths() {
        Dictionary dict = Dictionary.of(fixture(), Settings.defaults());
        assertEquals("day before yesterday".length(), dict.getMaxLength());
        assertEquals(1, dict.getMinLength());
    }
}
