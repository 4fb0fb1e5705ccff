package com.heronix.attendance.service;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.WindowCheck;

import lombok.RequiredArgsConstructor;

/**
 * Checks the current time against a period's attendance window.
 *
 * The window runs from the before-buffer ahead of the period start to the
 * after-buffer past its end, both inclusive, at minute precision.
 */
@Service
@RequiredArgsConstructor
public class TimeWindowService {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final AttendanceProperties properties;

    public WindowCheck isWithinWindow(LocalTime now, ResolvedPeriod period) {
        return isWithinWindow(now, period.startTime(), period.endTime());
    }

    public WindowCheck isWithinWindow(LocalTime now, LocalTime periodStart, LocalTime periodEnd) {
        AttendanceProperties.WindowConfig window = properties.getWindow();
        int nowMinutes = minuteOfDay(now.truncatedTo(ChronoUnit.MINUTES));
        int opensAt = minuteOfDay(periodStart) - window.getBeforeBufferMinutes();
        int closesAt = minuteOfDay(periodEnd) + window.getAfterBufferMinutes();

        if (nowMinutes < opensAt) {
            long wait = opensAt - nowMinutes;
            return WindowCheck.notYetOpen(String.format(
                    "The class period has not started yet. Attendance opens in %s, %d minutes before the class begins (at %s).",
                    formatWait(wait), window.getBeforeBufferMinutes(), HH_MM.format(periodStart)), wait);
        }
        if (nowMinutes > closesAt) {
            return WindowCheck.closed(String.format(
                    "The attendance window has closed. Attendance must be taken within %d minutes after the class ends (%s).",
                    window.getAfterBufferMinutes(), HH_MM.format(periodEnd)));
        }
        return WindowCheck.open();
    }

    /**
     * Pick the period whose start is closest to now; ties go to the earliest.
     */
    public Optional<ResolvedPeriod> selectClosest(LocalTime now, List<ResolvedPeriod> periods) {
        ResolvedPeriod best = null;
        long bestDistance = Long.MAX_VALUE;
        for (ResolvedPeriod period : periods) {
            long distance = Math.abs(Duration.between(period.startTime(), now).toMinutes());
            if (distance < bestDistance
                    || (distance == bestDistance && period.startTime().isBefore(best.startTime()))) {
                best = period;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * "H hour(s) and M minute(s)" from one hour on, "M minute(s)" below.
     */
    static String formatWait(long totalMinutes) {
        long hours = totalMinutes / 60;
        long minutes = totalMinutes % 60;
        String minutePart = minutes + (minutes == 1 ? " minute" : " minutes");
        if (hours > 0) {
            return hours + (hours == 1 ? " hour" : " hours") + " and " + minutePart;
        }
        return minutePart;
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
