package dateparserjava;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Lazily built state of one {@link Language} for one cache family (raw or normalized).
 *
 * <p>Each slot is filled once on first request and never invalidated. Concurrent first
 * requests may each build a value; only the first one stored is ever returned.</p>
 */
final class ModeCache {
    final AtomicReference<Dictionary> dictionary = new AtomicReference<>();
    final AtomicReference<List<Simplification>> simplifications = new AtomicReference<>();
    final AtomicReference<Set<String>> wordchars = new AtomicReference<>();
    final AtomicReference<Splitters> splitters = new AtomicReference<>();
    final PatternCache patterns = new PatternCache();

    /**
     * Returns the value held in {@code slot}, building and publishing it if the slot is empty.
     *
     * @param slot  the slot holding the cached value
     * @param build builds the value when the slot is empty
     * @param <T>   the value type
     * @return the cached or newly built value
     */
    static <T> T getOrInit(AtomicReference<T> slot, Supplier<T> build) {
        T v = slot.get();
        if (v != null) return v;
        T built = build.get();
        return slot.compareAndSet(null, built) ? built : slot.get();
    }
}
