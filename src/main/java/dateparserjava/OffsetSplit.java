package dateparserjava;

import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Result of {@link OffsetStripper#popOffset(String)}.
 */
public final class OffsetSplit {
    private final String remaining;
    private final ZoneOffset offset;

    public OffsetSplit(String remaining, ZoneOffset offset) {
        this.remaining = Objects.requireNonNull(remaining, "remaining");
        this.offset = offset;
    }

    public String getRemaining() {
        return remaining;
    }

    /**
     * The stripped offset.
     *
     * @return the offset, or {@code null} if the text had none
     */
    public ZoneOffset getOffset() {
        return offset;
    }

    public boolean hasOffset() {
        return offset != null;
    }

    @Override
    public String toString() {
        return "OffsetSplit{remaining='" + remaining + "', offset=" + offset + "}";
    }
}
