package dateparserjava;

import java.util.*;

/**
 * Plain descriptor handed to the downstream date-grammar engine: weekday, month and
 * hour/minute/second name lists plus jump and pertain words.
 *
 * <p>Each name slot holds every surface form of that name, e.g. the first weekday slot
 * of English is {@code [monday, mon]}.</p>
 */
public final class ParserInfo {
    public static final int WEEKDAY_COUNT = 7;
    public static final int MONTH_COUNT = 12;
    public static final int HMS_COUNT = 3;

    private final String name;
    private final List<String> jump;
    private final List<String> pertain;
    private final List<List<String>> weekdays;
    private final List<List<String>> months;
    private final List<List<String>> hms;

    /**
     * Creates a descriptor, checking list arities.
     *
     * @throws LanguageConfigurationException if weekdays, months or hms do not have
     *                                        exactly 7, 12 and 3 slots
     */
    public ParserInfo(String name,
                      List<String> jump,
                      List<String> pertain,
                      List<List<String>> weekdays,
                      List<List<String>> months,
                      List<List<String>> hms) {
        this.name = Objects.requireNonNull(name, "name");
        this.jump = Collections.unmodifiableList(new ArrayList<>(jump));
        this.pertain = Collections.unmodifiableList(new ArrayList<>(pertain));
        this.weekdays = slots(name, "weekdays", weekdays, WEEKDAY_COUNT);
        this.months = slots(name, "months", months, MONTH_COUNT);
        this.hms = slots(name, "hms", hms, HMS_COUNT);
    }

    private static List<List<String>> slots(String name, String what, List<List<String>> lists, int expected) {
        if (lists == null || lists.size() != expected) {
            throw new LanguageConfigurationException("Language " + name + ": expected " + expected + " " + what
                    + " but got " + (lists == null ? 0 : lists.size()));
        }
        List<List<String>> copy = new ArrayList<>(expected);
        for (List<String> slot : lists) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(slot)));
        }
        return Collections.unmodifiableList(copy);
    }

    public String getName() {
        return name;
    }

    public List<String> getJump() {
        return jump;
    }

    public List<String> getPertain() {
        return pertain;
    }

    public List<List<String>> getWeekdays() {
        return weekdays;
    }

    public List<List<String>> getMonths() {
        return months;
    }

    public List<List<String>> getHms() {
        return hms;
    }

    @Override
    public String toString() {
        return "<ParserInfo " + name + ">";
    }
}
