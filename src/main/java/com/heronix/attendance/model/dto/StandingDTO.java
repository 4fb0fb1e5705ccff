package com.heronix.attendance.model.dto;

import java.time.LocalDateTime;

import com.heronix.attendance.model.domain.StudentSubjectStanding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a cached analytics standing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StandingDTO {

    private Long studentId;
    private String subject;
    private Integer semester;
    private String trend;
    private String consistency;
    private String attentiveness;
    private String risk;
    private Long sourceSessionId;
    private LocalDateTime computedAt;

    public static StandingDTO fromEntity(StudentSubjectStanding standing) {
        return StandingDTO.builder()
                .studentId(standing.getStudentId())
                .subject(standing.getSubject())
                .semester(standing.getSemester())
                .trend(standing.getTrend())
                .consistency(standing.getConsistency())
                .attentiveness(standing.getAttentiveness())
                .risk(standing.getRisk())
                .sourceSessionId(standing.getSourceSessionId())
                .computedAt(standing.getComputedAt())
                .build();
    }
}
