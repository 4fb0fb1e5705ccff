package com.heronix.attendance.config;

import java.time.LocalTime;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.heronix.attendance.model.enums.StageTransport;
import com.heronix.attendance.model.enums.StageType;

import lombok.Data;

/**
 * Configuration properties for Heronix Attendance.
 */
@Data
@ConfigurationProperties(prefix = "heronix.attendance")
public class AttendanceProperties {

    /**
     * Attendance time window configuration
     */
    private WindowConfig window = new WindowConfig();

    /**
     * Timetable grid configuration
     */
    private TimetableConfig timetable = new TimetableConfig();

    /**
     * Session creation configuration
     */
    private SessionConfig session = new SessionConfig();

    /**
     * Face recognition service configuration
     */
    private RecognitionConfig recognition = new RecognitionConfig();

    /**
     * Analytics pipeline configuration
     */
    private AnalyticsConfig analytics = new AnalyticsConfig();

    @Data
    public static class WindowConfig {
        /**
         * Minutes before a period starts when a session may be opened
         */
        private int beforeBufferMinutes = 15;

        /**
         * Minutes after a period ends when a session may still be opened
         */
        private int afterBufferMinutes = 15;
    }

    @Data
    public static class TimetableConfig {
        /**
         * Start of the first period of the day (HH:mm)
         */
        private String firstPeriodStart = "09:00";

        /**
         * Length of one period on the grid, in minutes
         */
        private int periodDurationMinutes = 60;

        public LocalTime getFirstPeriodStartTime() {
            return LocalTime.parse(firstPeriodStart);
        }
    }

    @Data
    public static class SessionConfig {
        /**
         * Two sessions of the same class, subject and date whose times differ by
         * at most this many minutes are treated as the same time slot.
         * Pending product confirmation for non-hourly timetables.
         */
        private int duplicateSlotToleranceMinutes = 30;

        /**
         * Maximum number of sessions returned by list queries
         */
        private int listLimit = 100;
    }

    @Data
    public static class RecognitionConfig {
        /**
         * Face recognition service base URL
         */
        private String apiUrl = "http://localhost:8000";

        /**
         * Timeout for a recognition request in seconds
         */
        private int timeoutSeconds = 60;

        /**
         * Timeout for the health probe in seconds
         */
        private int healthTimeoutSeconds = 3;
    }

    @Data
    public static class AnalyticsConfig {
        /**
         * Run the pipeline after each submission
         */
        private boolean enabled = true;

        /**
         * Stage transport: http (remote inference service) or process (local worker)
         */
        private StageTransport transport = StageTransport.HTTP;

        /**
         * Inference service base URL for the http transport
         */
        private String baseUrl = "http://localhost:8000";

        /**
         * Worker executable for the process transport
         */
        private String workerCommand = "python";

        /**
         * Worker script per stage for the process transport
         */
        private Map<StageType, String> scripts = new EnumMap<>(StageType.class);

        /**
         * Upper bound for one stage invocation in seconds
         */
        private int stageTimeoutSeconds = 30;

        /**
         * Number of students processed in parallel
         */
        private int parallelStudents = 4;

        /**
         * Number of threads available for stage invocations
         */
        private int stageThreads = 8;

        /**
         * Planned number of sessions per subject, passed to the risk stage
         */
        private int totalSessionsPlanned = 50;
    }
}
