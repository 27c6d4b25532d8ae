package dateparserjava;

import java.util.*;

/**
 * Reassembles tokens into a string.
 *
 * <p>A separator goes between two consecutive tokens unless one of them is a capturing
 * splitter: capturing tokens attach directly to their neighbours, so {@code 10 : 30}
 * joins back to {@code 10:30}. Comma-like capturing tokens (see
 * {@link TokenSets#isCommaLike(String)}) only attach to the token on their left, so
 * {@code hello , world} joins to {@code hello, world}.</p>
 */
public final class Joiner {
    private final Set<String> capturing;

    /**
     * Creates a joiner for the given capturing splitters.
     *
     * @param capturing tokens that never get a separator around them
     */
    public Joiner(Collection<String> capturing) {
        this.capturing = Collections.unmodifiableSet(new HashSet<>(capturing));
    }

    /**
     * Joins tokens left to right.
     *
     * @param tokens    the tokens to join
     * @param separator the separator for non-capturing neighbours
     * @return the joined string; empty for an empty token list
     */
    public String join(List<String> tokens, String separator) {
        if (tokens == null || tokens.isEmpty()) return "";

        StringBuilder sb = new StringBuilder(tokens.get(0));
        for (int i = 1; i < tokens.size(); i++) {
            String left = tokens.get(i - 1);
            String right = tokens.get(i);
            if (needsSeparator(left, right)) {
                sb.append(separator);
            }
            sb.append(right);
        }
        return sb.toString();
    }

    /**
     * {@code ","} is not in the default capturing set, so the comma branch only matters
     * for custom capturing sets.
     */
    private boolean needsSeparator(String left, String right) {
        if (capturing.contains(right)) return false;
        if (capturing.contains(left)) return TokenSets.isCommaLike(left);
        return true;
    }

    public Set<String> getCapturing() {
        return capturing;
    }
}
