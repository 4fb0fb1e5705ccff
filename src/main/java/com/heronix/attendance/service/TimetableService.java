package com.heronix.attendance.service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.InvalidRequestException;
import com.heronix.attendance.exception.ResourceNotFoundException;
import com.heronix.attendance.exception.TimetableLockedException;
import com.heronix.attendance.model.domain.RecurringPeriod;
import com.heronix.attendance.model.domain.TimetableOverride;
import com.heronix.attendance.model.dto.PeriodEntryDTO;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.ResolvedSchedule;
import com.heronix.attendance.model.enums.ScheduleSource;
import com.heronix.attendance.repository.RecurringPeriodRepository;
import com.heronix.attendance.repository.TimetableOverrideRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the periods a class has on a date and manages the timetable.
 *
 * Date overrides shadow the weekly timetable entirely: as soon as one
 * override exists for (date, semester, department, section) the weekly
 * periods of that weekday are ignored for the date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimetableService {

    private final RecurringPeriodRepository recurringPeriodRepository;
    private final TimetableOverrideRepository overrideRepository;
    private final AttendanceProperties properties;

    /**
     * Position of a period on the class day.
     */
    public enum PeriodStatus {
        PAST,
        CURRENT,
        UPCOMING
    }

    /**
     * A resolved period with its status relative to a point in time.
     */
    public record ScheduledPeriod(
            ResolvedPeriod period,
            PeriodStatus status
    ) {}

    /**
     * Class schedule of a date as seen at a point in time.
     */
    public record ClassSchedule(
            ResolvedSchedule schedule,
            List<ScheduledPeriod> periods,
            ResolvedPeriod currentPeriod
    ) {}

    /**
     * Resolve the periods of a class on a date, ordered by start time.
     */
    @Transactional(readOnly = true)
    public ResolvedSchedule resolve(LocalDate date, Integer semester, String department, String section) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();

        List<TimetableOverride> overrides = overrideRepository
                .findByPeriodDateAndSemesterAndDepartmentAndSectionOrderByStartTimeAsc(
                        date, semester, department, section);

        if (!overrides.isEmpty()) {
            List<ResolvedPeriod> periods = overrides.stream()
                    .map(o -> toResolved(o.getSubject(), o.getStartTime(), o.getEndTime(), ScheduleSource.DATE_OVERRIDE))
                    .toList();
            return new ResolvedSchedule(date, dayOfWeek, periods, true);
        }

        List<ResolvedPeriod> periods = recurringPeriodRepository
                .findBySemesterAndDepartmentAndSectionAndDayOfWeekOrderByStartTimeAsc(
                        semester, department, section, dayOfWeek)
                .stream()
                .map(p -> toResolved(p.getSubject(), p.getStartTime(), p.getEndTime(), ScheduleSource.RECURRING))
                .toList();
        return new ResolvedSchedule(date, dayOfWeek, periods, false);
    }

    /**
     * Ordinal of a period on the daily grid. Periods starting before the
     * first period start get 0.
     */
    public int ordinalOf(LocalTime startTime) {
        AttendanceProperties.TimetableConfig grid = properties.getTimetable();
        long offset = Duration.between(grid.getFirstPeriodStartTime(), startTime).toMinutes();
        if (offset < 0) {
            return 0;
        }
        return (int) (offset / grid.getPeriodDurationMinutes()) + 1;
    }

    /**
     * Schedule of a class for a date with each period flagged past, current or upcoming
     * against the attendance window buffers.
     */
    @Transactional(readOnly = true)
    public ClassSchedule classSchedule(LocalDate date, Integer semester, String department, String section,
                                       LocalDateTime now) {
        ResolvedSchedule schedule = resolve(date, semester, department, section);
        AttendanceProperties.WindowConfig window = properties.getWindow();

        List<ScheduledPeriod> periods = new ArrayList<>();
        ResolvedPeriod current = null;

        for (ResolvedPeriod period : schedule.periods()) {
            LocalDateTime opens = date.atTime(period.startTime()).minusMinutes(window.getBeforeBufferMinutes());
            LocalDateTime closes = date.atTime(period.endTime()).plusMinutes(window.getAfterBufferMinutes());

            PeriodStatus status;
            if (now.isBefore(opens)) {
                status = PeriodStatus.UPCOMING;
            } else if (now.isAfter(closes)) {
                status = PeriodStatus.PAST;
            } else {
                status = PeriodStatus.CURRENT;
                if (current == null) {
                    current = period;
                }
            }
            periods.add(new ScheduledPeriod(period, status));
        }

        return new ClassSchedule(schedule, periods, current);
    }

    // ========================================================================
    // WEEKLY TIMETABLE
    // ========================================================================

    @Transactional(readOnly = true)
    public List<RecurringPeriod> listRecurring(Integer semester, String department, String section,
                                               DayOfWeek dayOfWeek) {
        return recurringPeriodRepository.search(semester, department, section, dayOfWeek);
    }

    @Transactional
    public RecurringPeriod createRecurring(Integer semester, String department, String section,
                                           DayOfWeek dayOfWeek, PeriodEntryDTO entry) {
        validateEntry(entry);

        RecurringPeriod period = RecurringPeriod.builder()
                .semester(semester)
                .department(department)
                .section(section)
                .subject(entry.subject())
                .dayOfWeek(dayOfWeek)
                .startTime(entry.startTime())
                .endTime(entry.endTime())
                .build();

        period = recurringPeriodRepository.save(period);
        log.info("Created weekly period {} {} {}-{} for {}-{}, Semester {}",
                entry.subject(), dayOfWeek, entry.startTime(), entry.endTime(), department, section, semester);
        return period;
    }

    @Transactional
    public void deleteRecurring(Long id) {
        if (!recurringPeriodRepository.existsById(id)) {
            throw new ResourceNotFoundException("Timetable period", id);
        }
        recurringPeriodRepository.deleteById(id);
        log.info("Deleted weekly period {}", id);
    }

    // ========================================================================
    // DATE OVERRIDES
    // ========================================================================

    /**
     * Replace the weekly timetable of one date for a class.
     *
     * @throws TimetableLockedException if the date already has overrides
     */
    @Transactional
    public List<TimetableOverride> createOverrides(LocalDate date, Integer semester, String department,
                                                   String section, List<PeriodEntryDTO> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new InvalidRequestException("At least one timetable entry is required");
        }
        entries.forEach(this::validateEntry);

        if (overrideRepository.existsByPeriodDateAndSemesterAndDepartmentAndSection(
                date, semester, department, section)) {
            log.warn("Rejected timetable change for locked date {} ({}-{}, Semester {})",
                    date, department, section, semester);
            throw new TimetableLockedException(date, department, section, semester);
        }

        List<TimetableOverride> overrides = entries.stream()
                .map(e -> TimetableOverride.builder()
                        .periodDate(date)
                        .dayOfWeek(date.getDayOfWeek())
                        .semester(semester)
                        .department(department)
                        .section(section)
                        .subject(e.subject())
                        .startTime(e.startTime())
                        .endTime(e.endTime())
                        .build())
                .toList();

        List<TimetableOverride> saved = overrideRepository.saveAll(overrides);
        log.info("Locked timetable for {} ({}-{}, Semester {}) with {} period(s)",
                date, department, section, semester, saved.size());
        return saved;
    }

    /**
     * Remove all overrides of a date, unlocking it.
     *
     * @return number of overrides removed
     */
    @Transactional
    public long deleteOverrides(LocalDate date, Integer semester, String department, String section) {
        long removed = overrideRepository.deleteByPeriodDateAndSemesterAndDepartmentAndSection(
                date, semester, department, section);
        log.info("Removed {} override(s) for {} ({}-{}, Semester {})", removed, date, department, section, semester);
        return removed;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private ResolvedPeriod toResolved(String subject, LocalTime start, LocalTime end, ScheduleSource source) {
        return new ResolvedPeriod(subject, start, end, ordinalOf(start), source);
    }

    private void validateEntry(PeriodEntryDTO entry) {
        if (entry.subject() == null || entry.subject().isBlank()
                || entry.startTime() == null || entry.endTime() == null) {
            throw new InvalidRequestException("Subject, start time and end time are required");
        }
        if (!entry.startTime().isBefore(entry.endTime())) {
            throw new InvalidRequestException(
                    "Start time " + entry.startTime() + " must be before end time " + entry.endTime());
        }
    }
}
