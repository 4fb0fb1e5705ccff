package com.heronix.attendance.lifecycle;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.heronix.attendance.exception.InvalidStateTransitionException;
import com.heronix.attendance.model.dto.ResolvedPeriod;
import com.heronix.attendance.model.dto.RosterEntryDTO;
import com.heronix.attendance.model.enums.SessionState;

import lombok.Getter;

/**
 * In-memory state of one attendance capture, from the moment a teacher
 * opens it until it is submitted or cancelled.
 *
 * All state changes go through the synchronized transition methods.
 */
@Getter
public class CaptureSession {

    private final UUID id;
    private final Long teacherId;
    private final Integer semester;
    private final String department;
    private final String section;
    private final String subject;
    private final LocalDate date;
    private final ResolvedPeriod period;
    private final LocalDateTime openedAt;

    private SessionState state;
    private final List<String> images = new ArrayList<>();
    private List<RosterEntryDTO> roster = List.of();
    private int totalFacesDetected;
    private int recognizedCount;
    private boolean recognizing;
    private Long submittedSessionId;

    public CaptureSession(Long teacherId, Integer semester, String department, String section, String subject,
                          LocalDate date, ResolvedPeriod period, LocalDateTime openedAt) {
        this.id = UUID.randomUUID();
        this.teacherId = teacherId;
        this.semester = semester;
        this.department = department;
        this.section = section;
        this.subject = subject;
        this.date = date;
        this.period = period;
        this.openedAt = openedAt;
        this.state = SessionState.CAPTURE;
    }

    public synchronized void addImages(List<String> newImages) {
        requireState(SessionState.CAPTURE, "add images");
        images.addAll(newImages);
    }

    public synchronized List<String> getImages() {
        return List.copyOf(images);
    }

    /**
     * Mark recognition as running and return the images to recognize.
     */
    public synchronized List<String> beginRecognition() {
        requireState(SessionState.CAPTURE, "run recognition");
        if (recognizing) {
            throw new InvalidStateTransitionException("Recognition is already running for this session");
        }
        recognizing = true;
        return List.copyOf(images);
    }

    /**
     * Leave CAPTURE for REVIEW with the draft roster; ignored when the session was cancelled meanwhile.
     */
    public synchronized void completeRecognition(List<RosterEntryDTO> draft, int facesDetected, int recognized) {
        recognizing = false;
        if (state != SessionState.CAPTURE) {
            return;
        }
        roster = List.copyOf(draft);
        totalFacesDetected = facesDetected;
        recognizedCount = recognized;
        state = SessionState.REVIEW;
    }

    public synchronized void failRecognition() {
        recognizing = false;
    }

    public synchronized void replaceRoster(List<RosterEntryDTO> reviewed) {
        requireState(SessionState.REVIEW, "edit the roster");
        roster = List.copyOf(reviewed);
    }

    public synchronized void markSubmitted(Long sessionId) {
        requireState(SessionState.REVIEW, "submit");
        submittedSessionId = sessionId;
        state = SessionState.SUBMITTED;
    }

    /**
     * Drop images and recognition results and return to FILTER.
     */
    public synchronized void cancel() {
        images.clear();
        roster = List.of();
        totalFacesDetected = 0;
        recognizedCount = 0;
        state = SessionState.FILTER;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized List<RosterEntryDTO> getRoster() {
        return roster;
    }

    public synchronized void requireState(SessionState expected, String action) {
        if (state != expected) {
            throw new InvalidStateTransitionException(String.format(
                    "Cannot %s while the session is in %s state", action, state));
        }
    }
}
