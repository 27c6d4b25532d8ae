package dateparserjava;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ParserInfoTest {

    private static List<List<String>> slots(int n) {
        List<List<String>> lists = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            lists.add(Collections.singletonList("name" + i));
        }
        return lists;
    }

    @Test
    void acceptsExpectedArities() {
        ParserInfo info = new ParserInfo("xx", Arrays.asList("and"), Collections.<String>emptyList(),
                slots(7), slots(12), slots(3));
        assertEquals(7, info.getWeekdays().size());
        assertEquals(Collections.singletonList("name11"), info.getMonths().get(11));
        assertEquals(Collections.singletonList("and"), info.getJump());
    }

    @Test
    void rejectsWrongArities() {
        List<String> none = Collections.emptyList();
        assertThrows(LanguageConfigurationException.class,
                () -> new ParserInfo("xx", none, none, slots(6), slots(12), slots(3)));
        assertThrows(LanguageConfigurationException.class,
                () -> new ParserInfo("xx", none, none, slots(7), slots(13), slots(3)));
        assertThrows(LanguageConfigurationException.class,
                () -> new ParserInfo("xx", none, none, slots(7), slots(12), slots(2)));
    }

    @Test
    void bundledLanguagesProject() {
        for (String code : LanguageLoader.bundledLanguages()) {
            ParserInfo info = LanguageLoader.getDefault().get(code).toParserInfo();
            assertEquals(code, info.getName());
            assertEquals(3, info.getHms().size());
        }
    }
}
