package com.heronix.attendance.model.dto;

import java.time.LocalDate;

import com.heronix.attendance.model.domain.EnrollmentInterval;
import com.heronix.attendance.model.enums.OwnerType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for enrollment intervals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnrollmentIntervalDTO {

    private Long id;
    private OwnerType ownerType;
    private Long ownerId;
    private Integer semester;
    private String department;
    private String section;
    private String subject;
    private LocalDate enrollmentDate;
    private LocalDate completionDate;

    /**
     * Whether the interval covers the reference date.
     */
    private boolean active;

    public static EnrollmentIntervalDTO fromEntity(EnrollmentInterval interval, LocalDate today) {
        return EnrollmentIntervalDTO.builder()
                .id(interval.getId())
                .ownerType(interval.getOwnerType())
                .ownerId(interval.getOwnerId())
                .semester(interval.getSemester())
                .department(interval.getDepartment())
                .section(interval.getSection())
                .subject(interval.getSubject())
                .enrollmentDate(interval.getEnrollmentDate())
                .completionDate(interval.getCompletionDate())
                .active(interval.isActiveOn(today))
                .build();
    }
}
