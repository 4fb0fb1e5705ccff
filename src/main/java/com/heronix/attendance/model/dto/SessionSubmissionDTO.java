package com.heronix.attendance.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session metadata and roster submitted at the end of a capture.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionSubmissionDTO {

    /**
     * Department code of the class.
     */
    @NotBlank
    private String classId;

    @NotBlank
    private String sectionId;

    @NotBlank
    private String subjectName;

    @NotNull
    @Min(1)
    @Max(8)
    private Integer semester;

    @NotNull
    private LocalDate sessionDate;

    @NotNull
    private LocalTime sessionTime;

    private String capturedImagePath;

    @NotNull
    @Min(0)
    private Integer totalStudents;

    @NotNull
    @Min(0)
    private Integer presentCount;

    @NotNull
    @Min(0)
    private Integer absentCount;

    private BigDecimal recognitionAccuracy;

    @NotEmpty
    @Valid
    private List<RosterEntryDTO> records;
}
