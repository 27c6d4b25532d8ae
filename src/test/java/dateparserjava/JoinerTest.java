package dateparserjava;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class JoinerTest {

    private final Joiner joiner = new Joiner(Arrays.asList(",", ":", "-", " "));

    @Test
    void glueCapturingTokens() {
        assertEquals("10:30", joiner.join(Arrays.asList("10", ":", "30"), " "));
        assertEquals("2015-01-10", joiner.join(Arrays.asList("2015", "-", "01", "-", "10"), " "));
    }

    @Test
    void commaKeepsSeparatorOnItsRight() {
        assertEquals("hello, world", joiner.join(Arrays.asList("hello", ",", "world"), " "));
    }

    @Test
    void ordinaryTokensGetSeparator() {
        assertEquals("1 day ago", joiner.join(Arrays.asList("1", "day", "ago"), " "));
        assertEquals("1dayago", joiner.join(Arrays.asList("1", "day", "ago"), ""));
    }

    @Test
    void emptyInput() {
        assertEquals("", joiner.join(Collections.<String>emptyList(), " "));
        assertEquals("x", joiner.join(Collections.singletonList("x"), " "));
    }
}
