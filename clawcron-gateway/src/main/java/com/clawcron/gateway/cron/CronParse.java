package com.clawcron.gateway.cron;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of user-supplied times, durations and time zones.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");
    private static final Pattern DURATION_RE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h|d)?$");

    /**
     * Normalize a date string to a UTC ISO-8601 string.
     * - If the string already has a timezone, return as-is.
     * - If it's a date only (2024-01-01), append T00:00:00Z.
     * - If it's a date-time without TZ (2024-01-01T12:00:00), append Z.
     */
    static String normalizeUtcIso(String raw) {
        if (ISO_TZ_RE.matcher(raw).find())
            return raw;
        if (ISO_DATE_RE.matcher(raw).matches())
            return raw + "T00:00:00Z";
        if (ISO_DATE_TIME_RE.matcher(raw).find())
            return raw + "Z";
        return raw;
    }

    /**
     * Parse an absolute time: epoch milliseconds as digits, or an ISO-8601
     * date/date-time (UTC unless an offset is given).
     *
     * @return epoch milliseconds, or null if parsing fails
     */
    public static Long parseAbsoluteTimeMs(String input) {
        if (input == null)
            return null;
        String raw = input.trim();
        if (raw.isEmpty())
            return null;

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? n : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        try {
            return Instant.parse(normalizeUtcIso(raw)).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Parse a duration such as {@code 1500}, {@code 90s}, {@code 10m},
     * {@code 1.5h} or {@code 2d}. A bare number is milliseconds.
     *
     * @return milliseconds, or null if the input is not a positive duration
     */
    public static Long parseDurationMs(String input) {
        if (input == null)
            return null;
        Matcher m = DURATION_RE.matcher(input.trim().toLowerCase(Locale.ROOT));
        if (!m.matches())
            return null;
        double amount;
        try {
            amount = Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        String unit = m.group(2) != null ? m.group(2) : "ms";
        long factor = switch (unit) {
            case "s" -> 1_000L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            case "d" -> 86_400_000L;
            default -> 1L;
        };
        long ms = Math.round(amount * factor);
        return ms > 0 ? ms : null;
    }

    /**
     * Resolve an IANA zone id; blank means the system default zone.
     *
     * @throws IllegalArgumentException for an unknown zone
     */
    public static ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid time zone: " + tz, e);
        }
    }
}
