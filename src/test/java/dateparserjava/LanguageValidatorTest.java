package dateparserjava;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LanguageValidatorTest {

    private final LanguageValidator validator = new LanguageValidator();

    static List<String> bundledLanguages() {
        return LanguageLoader.bundledLanguages();
    }

    @ParameterizedTest
    @MethodSource("bundledLanguages")
    void bundledLanguagesAreValid(String code) {
        assertTrue(LanguageLoader.getDefault().get(code).validateInfo());
    }

    @Test
    void missingNamesAreReported() {
        LanguageInfo info = LanguageInfo.builder("xx").words("monday", "mon").build();
        assertFalse(validator.validate("xx", info));
        assertFalse(validator.validateNames("xx", TokenSets.MONTHS, info));
    }

    @Test
    void blankNamesAreReported() {
        LanguageInfo info = LanguageInfo.builder("xx").words("monday", " ").build();
        assertFalse(validator.validateNames("xx", TokenSets.WEEKDAYS, info));
        assertFalse(validator.validateName("xx", LanguageInfo.builder(" ").build()));
    }

    @Test
    void brokenSimplificationsAreReported() {
        assertFalse(validator.validateSimplifications("xx",
                LanguageInfo.builder("xx").simplification("([", "x").build()));
        assertFalse(validator.validateSimplifications("xx",
                LanguageInfo.builder("xx").simplification("an", "\\g<1").build()));
        assertTrue(validator.validateSimplifications("xx",
                LanguageInfo.builder("xx").simplification("(\\d+)h", "\\1:00").build()));
    }

    @Test
    void splitterGroupMustBeKnown() {
        assertFalse(validator.validateSentenceSplitter("xx",
                LanguageInfo.builder("xx").sentenceSplitterGroup(9).build()));
        assertTrue(validator.validateSentenceSplitter("xx",
                LanguageInfo.builder("xx").sentenceSplitterGroup(6).build()));
    }

    @Test
    void emptyTokensAreReported() {
        LanguageInfo info = LanguageInfo.builder("xx").skip("and", "").build();
        assertFalse(validator.validateTokens("xx", "skip", info.getSkip()));
    }

    @Test
    void missingInfoIsInvalid() {
        assertFalse(validator.validate("xx", null));
    }
}
