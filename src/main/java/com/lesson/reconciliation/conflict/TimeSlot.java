package com.lesson.reconciliation.conflict;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A lesson's occupied minutes within its day, as {@code [start, end)}.
 */
record TimeSlot(int startMinute, int endMinute) {

    private static final Pattern CLOCK = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::\\d{2}(?:\\.\\d+)?)?$");

    /**
     * Builds the slot for a start time ({@code HH:mm} or {@code HH:mm:ss}) and a duration.
     */
    static Optional<TimeSlot> of(String startTime, int durationMinutes) {
        if (startTime == null) {
            return Optional.empty();
        }
        Matcher matcher = CLOCK.matcher(startTime.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        if (hours > 23 || minutes > 59) {
            return Optional.empty();
        }
        int start = hours * 60 + minutes;
        return Optional.of(new TimeSlot(start, start + durationMinutes));
    }

    /**
     * Open-interval overlap: slots that only touch do not overlap.
     */
    boolean overlaps(TimeSlot other) {
        return startMinute < other.endMinute && endMinute > other.startMinute;
    }
}
