package dateparserjava;

import java.util.*;

/**
 * Derived splitter sets of a language.
 *
 * <ul>
 *   <li><b>wordchars</b> – punctuation tokens that only act as a split boundary when
 *       not surrounded by dictionary word characters on both sides</li>
 *   <li><b>plain</b> – the remaining punctuation-only skip and capturing tokens, which
 *       split wherever they occur</li>
 *   <li><b>capturing</b> – tokens that survive tokenization and never get a
 *       separator inserted around them when joined</li>
 * </ul>
 */
public final class Splitters {
    private final Set<String> wordchars;
    private final Set<String> plain;
    private final Set<String> capturing;

    public Splitters(Set<String> wordchars, Set<String> plain, Set<String> capturing) {
        this.wordchars = Collections.unmodifiableSet(new LinkedHashSet<>(wordchars));
        this.plain = Collections.unmodifiableSet(new LinkedHashSet<>(plain));
        this.capturing = Collections.unmodifiableSet(new LinkedHashSet<>(capturing));
    }

    public Set<String> getWordchars() {
        return wordchars;
    }

    public Set<String> getPlain() {
        return plain;
    }

    public Set<String> getCapturing() {
        return capturing;
    }

    @Override
    public String toString() {
        return "Splitters{wordchars=" + wordchars + ", plain=" + plain + ", capturing=" + capturing + "}";
    }
}
