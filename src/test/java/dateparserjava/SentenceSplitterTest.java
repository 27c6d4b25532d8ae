package dateparserjava;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class SentenceSplitterTest {

    @Test
    void defaultSplitsOnTerminalPunctuation() {
        assertEquals(Arrays.asList("One", "Two", "Three"), SentenceSplitter.DEFAULT.split("One. Two! Three"));
        assertEquals(Arrays.asList("a", "b"), SentenceSplitter.DEFAULT.split("a\r\nb\n"));
    }

    @Test
    void spanishHandlesInvertedMarks() {
        assertEquals(Arrays.asList("Vienes", "Sí"), SentenceSplitter.SPANISH.split("¿Vienes? Sí."));
        assertEquals(Collections.singletonList("3.5 horas"), SentenceSplitter.SPANISH.split("3.5 horas"));
    }

    @Test
    void cjkSplitsOnFullWidthMarks() {
        assertEquals(Arrays.asList("今天", "明天"), SentenceSplitter.CJK.split("今天。明天！"));
    }

    @Test
    void thaiSplitsOnLineBreaksOnly() {
        assertEquals(Arrays.asList("a. b", "c"), SentenceSplitter.THAI.split("a. b\nc"));
    }

    @Test
    void resolvesGroups() {
        assertSame(SentenceSplitter.ARABIC, SentenceSplitter.forGroup(6));
        assertNull(SentenceSplitter.tryParse(0));
        assertThrows(LanguageConfigurationException.class, () -> SentenceSplitter.forGroup(7));
        assertSame(SentenceSplitter.DEFAULT, SentenceSplitter.forInfo(LanguageInfo.builder("x").build()));
        assertSame(SentenceSplitter.CJK,
                SentenceSplitter.forInfo(LanguageInfo.builder("x").sentenceSplitterGroup(4).build()));
    }
}
