package dateparserjava;

/**
 * Strips a trailing timezone designation from a date string.
 */
@FunctionalInterface
public interface OffsetStripper {

    /**
     * Splits a trailing timezone offset off {@code text}.
     *
     * @param text the date string
     * @return the remaining text and the offset, which is {@code null} when none was found
     */
    OffsetSplit popOffset(String text);
}
