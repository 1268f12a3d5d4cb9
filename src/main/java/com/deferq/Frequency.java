package com.deferq;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relative time modifier of a recurring job, e.g. {@code "+1 hour"},
 * {@code "+2 days +6 hours"} or {@code "weekly"}.
 * <p>
 * Calendar units (day and larger) are applied to the wall-clock time of the
 * zone, so {@code "+1 day"} keeps the same local time across a DST change.
 * Second, minute and hour units are applied to the instant.
 */
public final class Frequency {

    private static final Pattern TERM = Pattern.compile("\\s*([+-]?)\\s*(\\d{1,9})\\s*([a-z]+)\\s*");

    private static final Map<String, Unit> KEYWORDS = Map.of(
            "hourly", Unit.HOUR,
            "daily", Unit.DAY,
            "weekly", Unit.WEEK,
            "monthly", Unit.MONTH,
            "yearly", Unit.YEAR);

    private final String text;
    private final List<Term> terms;

    private Frequency(String text, List<Term> terms) {
        this.text = text;
        this.terms = terms;
    }

    public static Frequency parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Frequency must not be blank");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        Unit keyword = KEYWORDS.get(normalized);
        if (keyword != null) {
            return new Frequency(text.trim(), List.of(new Term(1, keyword)));
        }

        List<Term> terms = new ArrayList<>();
        Matcher matcher = TERM.matcher(normalized);
        int position = 0;
        while (position < normalized.length()) {
            matcher.region(position, normalized.length());
            if (!matcher.lookingAt()) {
                throw invalid(text);
            }
            Unit unit = Unit.fromName(matcher.group(3));
            if (unit == null) {
                throw invalid(text);
            }
            long amount = Long.parseLong(matcher.group(2));
            terms.add(new Term("-".equals(matcher.group(1)) ? -amount : amount, unit));
            position = matcher.end();
        }
        if (terms.isEmpty()) {
            throw invalid(text);
        }
        return new Frequency(text.trim(), List.copyOf(terms));
    }

    public String text() {
        return text;
    }

    public ZonedDateTime applyTo(ZonedDateTime dateTime) {
        ZonedDateTime result = dateTime;
        for (Term term : terms) {
            result = term.unit().add(result, term.amount());
        }
        return result;
    }

    public OffsetDateTime applyTo(OffsetDateTime dateTime, ZoneId zone) {
        return applyTo(dateTime.atZoneSameInstant(zone)).toOffsetDateTime();
    }

    /**
     * Whether one application moves {@code reference} strictly forward.
     */
    public boolean advances(OffsetDateTime reference, ZoneId zone) {
        return applyTo(reference, zone).isAfter(reference);
    }

    private static IllegalArgumentException invalid(String text) {
        return new IllegalArgumentException("Unsupported frequency '" + text
                + "'. Expected terms like '+1 hour' or '+2 days', or one of hourly, daily, weekly, monthly, yearly.");
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Frequency that && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    private record Term(long amount, Unit unit) {
    }

    private enum Unit {
        SECOND("sec", "second") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusSeconds(amount);
            }
        },
        MINUTE("min", "minute") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusMinutes(amount);
            }
        },
        HOUR("hour") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusHours(amount);
            }
        },
        DAY("day") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusDays(amount);
            }
        },
        WEEK("week") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusWeeks(amount);
            }
        },
        FORTNIGHT("fortnight") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusWeeks(2 * amount);
            }
        },
        MONTH("month") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusMonths(amount);
            }
        },
        YEAR("year") {
            @Override
            ZonedDateTime add(ZonedDateTime dateTime, long amount) {
                return dateTime.plusYears(amount);
            }
        };

        private final List<String> names;

        Unit(String... names) {
            this.names = List.of(names);
        }

        abstract ZonedDateTime add(ZonedDateTime dateTime, long amount);

        static Unit fromName(String name) {
            String singular = name.endsWith("s") ? name.substring(0, name.length() - 1) : name;
            for (Unit unit : values()) {
                if (unit.names.contains(name) || unit.names.contains(singular)) {
                    return unit;
                }
            }
            return null;
        }
    }
}
