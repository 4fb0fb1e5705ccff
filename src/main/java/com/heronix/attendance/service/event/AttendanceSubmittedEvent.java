package com.heronix.attendance.service.event;

/**
 * Published inside the submission transaction; listeners see it only once the session is committed.
 */
public record AttendanceSubmittedEvent(
        Long sessionId,
        Long teacherId,
        Integer semester,
        String subject
) {}
