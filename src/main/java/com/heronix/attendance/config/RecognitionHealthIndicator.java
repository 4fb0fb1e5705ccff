package com.heronix.attendance.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.attendance.adapter.recognition.FaceRecognitionClient;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the face recognition service.
 *
 * Reports UP when the recognition service answers its health probe.
 * Reports DOWN otherwise; capture sessions cannot reach review until it is back,
 * since there is no fallback recognizer.
 */
@Component
@RequiredArgsConstructor
public class RecognitionHealthIndicator implements HealthIndicator {

    private final FaceRecognitionClient recognitionClient;
    private final AttendanceProperties properties;

    @Override
    public Health health() {
        boolean available = recognitionClient.isAvailable();

        if (available) {
            return Health.up()
                    .withDetail("recognition-service", "connected")
                    .withDetail("url", properties.getRecognition().getApiUrl())
                    .build();
        } else {
            return Health.down()
                    .withDetail("recognition-service", "unreachable")
                    .withDetail("url", properties.getRecognition().getApiUrl())
                    .withDetail("fallback", "none")
                    .build();
        }
    }
}
