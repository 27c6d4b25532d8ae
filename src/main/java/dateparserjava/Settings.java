package dateparserjava;

import java.util.*;

/**
 * Per-call processing options.
 *
 * <p>{@code normalize} selects which cache family (raw or Unicode-normalized) a
 * {@link Language} uses; {@code skipTokens} are extra words the dictionary treats as
 * known deletions. Instances are immutable and are passed explicitly to every
 * public operation.</p>
 */
public final class Settings {
    /**
     * Skip tokens applied when none are given: a lone {@code t} between date and time.
     */
    public static final List<String> DEFAULT_SKIP_TOKENS = Collections.singletonList("t");

    private static final Settings DEFAULTS = new Settings(false, DEFAULT_SKIP_TOKENS);

    private final boolean normalize;
    private final List<String> skipTokens;
    private final CacheKey cacheKey;

    private Settings(boolean normalize, Collection<String> skipTokens) {
        this.normalize = normalize;
        List<String> lowered = new ArrayList<>(skipTokens.size());
        for (String token : skipTokens) {
            lowered.add(Objects.requireNonNull(token, "skip token").toLowerCase(Locale.ROOT));
        }
        this.skipTokens = Collections.unmodifiableList(lowered);
        this.cacheKey = new CacheKey(normalize, this.skipTokens);
    }

    /**
     * Returns the default settings: raw mode with {@link #DEFAULT_SKIP_TOKENS}.
     *
     * @return the shared default instance
     */
    public static Settings defaults() {
        return DEFAULTS;
    }

    /**
     * Returns default settings in normalized mode.
     *
     * @return settings with {@code normalize = true}
     */
    public static Settings normalized() {
        return DEFAULTS.withNormalize(true);
    }

    public Settings withNormalize(boolean normalize) {
        return normalize == this.normalize ? this : new Settings(normalize, skipTokens);
    }

    public Settings withSkipTokens(Collection<String> skipTokens) {
        return new Settings(normalize, Objects.requireNonNull(skipTokens, "skipTokens"));
    }

    public boolean isNormalize() {
        return normalize;
    }

    public List<String> getSkipTokens() {
        return skipTokens;
    }

    CacheKey cacheKey() {
        return cacheKey;
    }

    @Override
    public String toString() {
        return "Settings{normalize=" + normalize + ", skipTokens=" + skipTokens + "}";
    }

    /**
     * Identifies one cache family inside a {@link Language}.
     */
    static final class CacheKey {
        final boolean normalize;
        final List<String> skipTokens;
        private final int hash;

        CacheKey(boolean normalize, List<String> skipTokens) {
            this.normalize = normalize;
            this.skipTokens = skipTokens;
            this.hash = (skipTokens.hashCode() * 397) ^ (normalize ? 1 : 0);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof CacheKey)) return false;
            CacheKey k = (CacheKey) o;
            return k.normalize == normalize && k.skipTokens.equals(skipTokens);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return (normalize ? "normalized" : "raw") + skipTokens;
        }
    }
}
