package com.heronix.attendance.controller.api;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.attendance.model.domain.RecurringPeriod;
import com.heronix.attendance.model.dto.PeriodEntryDTO;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.enums.ScheduleSource;
import com.heronix.attendance.service.TimetableService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;

/**
 * REST API for the weekly timetable and date overrides.
 */
@RestController
@RequestMapping("/api/v1/timetable")
@RequiredArgsConstructor
@Tag(name = "Timetable", description = "Weekly periods, date overrides and resolved schedules")
public class TimetableController {

    private final TimetableService timetableService;
    private final Clock clock;

    @GetMapping("/periods")
    @Operation(summary = "List weekly periods")
    public ResponseEntity<List<RecurringPeriod>> listPeriods(
            @RequestParam(required = false) Integer semester,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) String section,
            @RequestParam(required = false) DayOfWeek day) {
        return ResponseEntity.ok(timetableService.listRecurring(semester, department, section, day));
    }

    @PostMapping("/periods")
    @Operation(summary = "Create weekly period")
    @ApiResponse(responseCode = "201", description = "Period created")
    public ResponseEntity<RecurringPeriod> createPeriod(@Valid @RequestBody RecurringPeriodRequest request) {
        RecurringPeriod period = timetableService.createRecurring(request.semester(), request.department(),
                request.section(), request.day(), new PeriodEntryDTO(request.subject(), request.startTime(), request.endTime()));
        return ResponseEntity.status(HttpStatus.CREATED).body(period);
    }

    @DeleteMapping("/periods/{id}")
    @Operation(summary = "Delete weekly period")
    public ResponseEntity<Void> deletePeriod(@PathVariable Long id) {
        timetableService.deleteRecurring(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/for-date")
    @Operation(summary = "Timetable for a date", description = "Resolved periods with lock state and source")
    public ResponseEntity<ForDateResponse> forDate(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam Integer semester,
            @RequestParam String department,
            @RequestParam String section) {

        var schedule = timetableService.resolve(date, semester, department, section);
        return ResponseEntity.ok(new ForDateResponse(date, schedule.dayOfWeek(), schedule.dateOverride(),
                schedule.dateOverride() ? ScheduleSource.DATE_OVERRIDE : ScheduleSource.RECURRING,
                schedule.periods()));
    }

    @PostMapping("/overrides")
    @Operation(summary = "Override a date", description = "Replace the weekly timetable of one date; locks the date")
    @ApiResponse(responseCode = "201", description = "Overrides stored")
    @ApiResponse(responseCode = "409", description = "Date already locked")
    public ResponseEntity<Map<String, Object>> createOverrides(@Valid @RequestBody OverrideRequest request) {
        var saved = timetableService.createOverrides(request.date(), request.semester(), request.department(),
                request.section(), request.entries());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "date", request.date(),
                "locked", true,
                "periodCount", saved.size()));
    }

    @DeleteMapping("/overrides")
    @Operation(summary = "Remove date overrides", description = "Unlock a date so it can be overridden again")
    public ResponseEntity<Map<String, Object>> deleteOverrides(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam Integer semester,
            @RequestParam String department,
            @RequestParam String section) {
        long removed = timetableService.deleteOverrides(date, semester, department, section);
        return ResponseEntity.ok(Map.of("date", date, "removed", removed));
    }

    @GetMapping("/class-schedule")
    @Operation(summary = "Class schedule", description = "Periods of a date flagged past, current or upcoming")
    public ResponseEntity<TimetableService.ClassSchedule> classSchedule(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam Integer semester,
            @RequestParam String department,
            @RequestParam String section) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate day = date != null ? date : now.toLocalDate();
        return ResponseEntity.ok(timetableService.classSchedule(day, semester, department, section, now));
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record RecurringPeriodRequest(
            @NotNull Integer semester,
            @NotBlank String department,
            @NotBlank String section,
            @NotNull DayOfWeek day,
            @NotBlank String subject,
            @NotNull LocalTime startTime,
            @NotNull LocalTime endTime
    ) {}

    public record OverrideRequest(
            @NotNull LocalDate date,
            @NotNull Integer semester,
            @NotBlank String department,
            @NotBlank String section,
            @NotEmpty List<PeriodEntryDTO> entries
    ) {}

    public record ForDateResponse(
            LocalDate date,
            DayOfWeek dayOfWeek,
            boolean locked,
            ScheduleSource source,
            List<ResolvedPeriod> periods
    ) {}
}
