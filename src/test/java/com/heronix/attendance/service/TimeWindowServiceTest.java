package com.heronix.attendance.service;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.WindowCheck;
import com.heronix.attendance.model.enums.ScheduleSource;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimeWindowServiceTest {

    private final TimeWindowService windowService = new TimeWindowService(new AttendanceProperties());

    private final ResolvedPeriod period = new ResolvedPeriod("DBMS", LocalTime.of(9, 0), LocalTime.of(10, 0),
            1, ScheduleSource.RECURRING);

    @Test
    void opensFifteenMinutesBeforeTheStart() {
        assertThat(windowService.isWithinWindow(LocalTime.of(8, 45), period).allowed()).isTrue();

        WindowCheck early = windowService.isWithinWindow(LocalTime.of(8, 44), period);
        assertThat(early.allowed()).isFalse();
        assertThat(early.minutesUntilOpen()).isEqualTo(1L);
        assertThat(early.reason()).contains("Attendance opens in 1 minute").contains("(at 09:00)");
    }

    @Test
    void closesFifteenMinutesAfterTheEnd() {
        assertThat(windowService.isWithinWindow(LocalTime.of(10, 15), period).allowed()).isTrue();
        assertThat(windowService.isWithinWindow(LocalTime.of(10, 15, 59), period).allowed()).isTrue();

        WindowCheck late = windowService.isWithinWindow(LocalTime.of(10, 16), period);
        assertThat(late.allowed()).isFalse();
        assertThat(late.minutesUntilOpen()).isNull();
        assertThat(late.reason()).contains("within 15 minutes after the class ends (10:00)");
    }

    @Test
    void reportsLongWaitsInHoursAndMinutes() {
        WindowCheck check = windowService.isWithinWindow(LocalTime.of(7, 40), period);

        assertThat(check.minutesUntilOpen()).isEqualTo(65L);
        assertThat(check.reason()).contains("1 hour and 5 minutes");
    }

    @Test
    void formatsWaits() {
        assertThat(TimeWindowService.formatWait(1)).isEqualTo("1 minute");
        assertThat(TimeWindowService.formatWait(45)).isEqualTo("45 minutes");
        assertThat(TimeWindowService.formatWait(61)).isEqualTo("1 hour and 1 minute");
        assertThat(TimeWindowService.formatWait(150)).isEqualTo("2 hours and 30 minutes");
    }

    @Test
    void honoursConfiguredBuffers() {
        AttendanceProperties properties = new AttendanceProperties();
        properties.getWindow().setBeforeBufferMinutes(5);
        properties.getWindow().setAfterBufferMinutes(0);
        TimeWindowService strict = new TimeWindowService(properties);

        assertThat(strict.isWithinWindow(LocalTime.of(8, 50), period).allowed()).isFalse();
        assertThat(strict.isWithinWindow(LocalTime.of(8, 55), period).allowed()).isTrue();
        assertThat(strict.isWithinWindow(LocalTime.of(10, 1), period).allowed()).isFalse();
    }

    @Test
    void selectsThePeriodClosestToNow() {
        ResolvedPeriod second = new ResolvedPeriod("OS", LocalTime.of(10, 0), LocalTime.of(11, 0),
                2, ScheduleSource.RECURRING);
        ResolvedPeriod third = new ResolvedPeriod("CN", LocalTime.of(11, 0), LocalTime.of(12, 0),
                3, ScheduleSource.RECURRING);

        assertThat(windowService.selectClosest(LocalTime.of(10, 20), List.of(period, second, third)))
                .contains(second);
        assertThat(windowService.selectClosest(LocalTime.of(10, 30), List.of(third, second)))
                .contains(second);
        assertThat(windowService.selectClosest(LocalTime.of(10, 30), List.of())).isEmpty();
    }
}
