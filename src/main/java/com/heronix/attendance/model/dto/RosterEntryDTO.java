package com.heronix.attendance.model.dto;

import java.math.BigDecimal;

import com.heronix.attendance.model.enums.AttendanceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One student line of a roster being submitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RosterEntryDTO {

    /**
     * University serial number of the student.
     */
    private String usn;

    private AttendanceStatus status;

    /**
     * Recognition confidence (0-1), null for manual entries.
     */
    private BigDecimal confidence;

    private String emotion;

    private String attentiveness;

    /**
     * Reason for an excused absence.
     */
    private String reasonType;
}
