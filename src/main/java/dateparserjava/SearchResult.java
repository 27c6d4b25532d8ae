package dateparserjava;

import java.util.*;

/**
 * Date-like spans found in free text: translated chunks and the original text of each
 * chunk, aligned by index.
 */
public final class SearchResult {
    private final List<String> translated;
    private final List<String> original;

    public SearchResult(List<String> translated, List<String> original) {
        if (translated.size() != original.size()) {
            throw new IllegalArgumentException("Chunk lists differ in size: "
                    + translated.size() + " vs " + original.size());
        }
        this.translated = Collections.unmodifiableList(new ArrayList<>(translated));
        this.original = Collections.unmodifiableList(new ArrayList<>(original));
    }

    public List<String> getTranslated() {
        return translated;
    }

    public List<String> getOriginal() {
        return original;
    }

    public int size() {
        return translated.size();
    }

    public boolean isEmpty() {
        return translated.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SearchResult)) return false;
        SearchResult r = (SearchResult) o;
        return r.translated.equals(translated) && r.original.equals(original);
    }

    @Override
    public int hashCode() {
        return translated.hashCode() * 31 + original.hashCode();
    }

    @Override
    public String toString() {
        return "SearchResult{translated=" + translated + ", original=" + original + "}";
    }
}
