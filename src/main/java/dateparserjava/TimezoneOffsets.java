package dateparserjava;

import java.time.ZoneOffset;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link OffsetStripper}: recognizes numeric offsets ({@code +05:30},
 * {@code -0800}, {@code UTC+3}) and common abbreviations ({@code UTC}, {@code EST},
 * {@code JST}, ...) at the end of a string.
 *
 * <p>Bare numeric offsets must follow whitespace, or use the {@code ±hh:mm} form right
 * after a time, so that the tail of {@code 10-10-2014} is not mistaken for an offset.
 * Abbreviations must follow a digit, as in {@code 12:00 EST} or {@code 10:00Z}; a trailing
 * word such as the {@code z} of {@code "plan z"} is left in place.</p>
 */
public final class TimezoneOffsets implements OffsetStripper {

    /**
     * Shared stateless instance.
     */
    public static final TimezoneOffsets INSTANCE = new TimezoneOffsets();

    private static final Map<String, ZoneOffset> ABBREVIATIONS;

    static {
        Map<String, ZoneOffset> m = new LinkedHashMap<>();
        m.put("utc", ZoneOffset.UTC);
        m.put("gmt", ZoneOffset.UTC);
        m.put("z", ZoneOffset.UTC);
        m.put("est", ZoneOffset.ofHours(-5));
        m.put("edt", ZoneOffset.ofHours(-4));
        m.put("cst", ZoneOffset.ofHours(-6));
        m.put("cdt", ZoneOffset.ofHours(-5));
        m.put("mst", ZoneOffset.ofHours(-7));
        m.put("mdt", ZoneOffset.ofHours(-6));
        m.put("pst", ZoneOffset.ofHours(-8));
        m.put("pdt", ZoneOffset.ofHours(-7));
        m.put("bst", ZoneOffset.ofHours(1));
        m.put("cet", ZoneOffset.ofHours(1));
        m.put("cest", ZoneOffset.ofHours(2));
        m.put("eet", ZoneOffset.ofHours(2));
        m.put("eest", ZoneOffset.ofHours(3));
        m.put("msk", ZoneOffset.ofHours(3));
        m.put("ist", ZoneOffset.ofHoursMinutes(5, 30));
        m.put("jst", ZoneOffset.ofHours(9));
        m.put("kst", ZoneOffset.ofHours(9));
        m.put("aest", ZoneOffset.ofHours(10));
        ABBREVIATIONS = Collections.unmodifiableMap(m);
    }

    private static final Pattern NAMED_OFFSET = Pattern.compile(
            "(?:^|\\s|(?<=\\d))(utc|gmt)\\s*(?:([+-])(\\d{1,2})(?::?(\\d{2}))?)?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SPACED_OFFSET = Pattern.compile(
            "(?:^|\\s)([+-])(\\d{2}):?(\\d{2})\\s*$");

    private static final Pattern ATTACHED_OFFSET = Pattern.compile(
            "(?<=\\d)([+-])(\\d{2}):(\\d{2})\\s*$");

    private static final Pattern ABBREVIATION = Pattern.compile(
            "(?<=\\d)\\s*([a-z]{1,4})\\s*$",
            Pattern.CASE_INSENSITIVE);

    private TimezoneOffsets() {
    }

    @Override
    public OffsetSplit popOffset(String text) {
        Objects.requireNonNull(text, "text");

        Matcher m = NAMED_OFFSET.matcher(text);
        if (m.find()) {
            ZoneOffset offset = m.group(2) == null
                    ? ZoneOffset.UTC
                    : offset(m.group(2), m.group(3), m.group(4));
            if (offset != null) return split(text, m.start(), offset);
        }

        m = SPACED_OFFSET.matcher(text);
        if (m.find()) {
            ZoneOffset offset = offset(m.group(1), m.group(2), m.group(3));
            if (offset != null) return split(text, m.start(), offset);
        }

        m = ATTACHED_OFFSET.matcher(text);
        if (m.find()) {
            ZoneOffset offset = offset(m.group(1), m.group(2), m.group(3));
            if (offset != null) return split(text, m.start(), offset);
        }

        m = ABBREVIATION.matcher(text);
        if (m.find()) {
            ZoneOffset offset = ABBREVIATIONS.get(m.group(1).toLowerCase(Locale.ROOT));
            if (offset != null) return split(text, m.start(), offset);
        }

        return new OffsetSplit(text, null);
    }

    private static OffsetSplit split(String text, int start, ZoneOffset offset) {
        return new OffsetSplit(stripTrailing(text.substring(0, start)), offset);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    private static ZoneOffset offset(String sign, String hours, String minutes) {
        int h = Integer.parseInt(hours);
        int min = minutes == null ? 0 : Integer.parseInt(minutes);
        // ZoneOffset accepts up to ±18:00, real zones stop at ±14:00
        if (h > 14 || min > 59) return null;
        return "-".equals(sign) ? ZoneOffset.ofHoursMinutes(-h, -min) : ZoneOffset.ofHoursMinutes(h, min);
    }

    /**
     * Abbreviations this stripper recognizes, lowercase.
     *
     * @return abbreviation → offset
     */
    public static Map<String, ZoneOffset> abbreviations() {
        return ABBREVIATIONS;
    }
}
