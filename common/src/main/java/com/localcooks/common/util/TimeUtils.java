package com.localcooks.common.util;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slot and date formatting for kitchen bookings.
 * Booking times are wall-clock values in the kitchen location's timezone.
 */
public final class TimeUtils {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/St_Johns");

    private static final Pattern HH_MM = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");
    private static final String RANGE_SEPARATOR = " – ";
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MMM d", Locale.US);
    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("EEE, MMM d, yyyy", Locale.US);
    private static final DateTimeFormatter ZONE_ABBREVIATION = DateTimeFormatter.ofPattern("z", Locale.US);

    private TimeUtils() {
        // Utility class
    }

    /**
     * {@code "13:05" -> "1:05 PM"}, {@code "00:00" -> "12:00 AM"}.
     *
     * @throws IllegalArgumentException if the input is not a 24-hour {@code HH:MM} value
     */
    public static String formatTimeOfDay(String hhmm) {
        LocalTime time = parseTimeOfDay(hhmm);
        int displayHour = time.getHour() % 12 == 0 ? 12 : time.getHour() % 12;
        String period = time.getHour() >= 12 ? "PM" : "AM";
        return String.format("%d:%02d %s", displayHour, time.getMinute(), period);
    }

    public static LocalTime parseTimeOfDay(String hhmm) {
        if (hhmm == null) {
            throw new IllegalArgumentException("Time of day is required");
        }
        Matcher matcher = HH_MM.matcher(hhmm);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Time of day must be HH:MM between 00:00 and 23:59, got: " + hhmm);
        }
        return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    /**
     * Empty when both ends are absent, one date when they are equal (or only one is present),
     * otherwise {@code "Feb 3 – Feb 10"}.
     */
    public static String formatDateRange(LocalDate start, LocalDate end) {
        if (start == null && end == null) {
            return "";
        }
        if (start == null || end == null || start.equals(end)) {
            return SHORT_DATE.format(start != null ? start : end);
        }
        return SHORT_DATE.format(start) + RANGE_SEPARATOR + SHORT_DATE.format(end);
    }

    /**
     * Full slot label in the location's zone, e.g. {@code "Mon, Feb 2, 2026 9:00 AM – 1:00 PM NST"}.
     * The end time is assumed to fall on the same day.
     */
    public static String formatSlot(LocalDate bookingDate, String startTime, String endTime, ZoneId zone) {
        ZoneId effectiveZone = zone != null ? zone : DEFAULT_ZONE;
        ZonedDateTime start = ZonedDateTime.of(bookingDate, parseTimeOfDay(startTime), effectiveZone);
        return LONG_DATE.format(bookingDate) + " " + formatTimeOfDay(startTime)
                + RANGE_SEPARATOR + formatTimeOfDay(endTime) + " " + ZONE_ABBREVIATION.format(start);
    }

    public static ZoneId zoneOrDefault(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return DEFAULT_ZONE;
        }
        return ZoneId.of(zoneId);
    }
}
