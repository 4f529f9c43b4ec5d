package tech.webextools.cli.recording;

import tech.webextools.sdk.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a reporting period ending now into consecutive windows of at most {@code span} days.
 *
 * <p>Windows are returned newest first. A window ends {@code i} days before now and starts at
 * 23:59:59 of the day holding the instant one second before its span begins.
 */
public class TimeRanges {

    static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final Clock clock;

    public TimeRanges(Clock clock) {
        this.clock = clock;
    }

    public List<TimeRange> split(int totalDays, int span) {
        if (totalDays <= 0 || span <= 0) {
            throw new ValidationException("period", "Period and span must be positive");
        }
        int step = Math.min(span, totalDays);
        LocalDateTime now = LocalDateTime.now(clock).withNano(0);

        List<TimeRange> ranges = new ArrayList<>();
        for (int i = 0; i < totalDays; i += step) {
            int days = Math.min(step, totalDays - i);
            LocalDateTime start = now.minusDays(i + days).minusSeconds(1).with(END_OF_DAY);
            LocalDateTime end = now.minusDays(i);
            ranges.add(new TimeRange(FORMAT.format(start), FORMAT.format(end)));
        }
        return ranges;
    }
}
