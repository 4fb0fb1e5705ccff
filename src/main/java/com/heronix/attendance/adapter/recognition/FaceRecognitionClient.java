package com.heronix.attendance.adapter.recognition;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.RecognitionServiceException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Low-level client for the face recognition inference service.
 *
 * POST /recognize takes the captured images plus the reference embeddings of
 * the enrolled students and returns the students it matched. Any transport
 * error, non-2xx answer or unusable body is a hard failure: there is no
 * fallback recognizer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FaceRecognitionClient {

    private final WebClient.Builder webClientBuilder;
    private final AttendanceProperties properties;

    /**
     * Run recognition over the captured images.
     *
     * @param images   base64 encoded images
     * @param students enrolled students that have a reference embedding
     * @return recognized students and detection statistics
     * @throws RecognitionServiceException when the service fails or answers with an unusable body
     */
    public RecognitionResult recognize(List<String> images, List<EnrolledFace> students) {
        WebClient client = createClient();
        Duration timeout = Duration.ofSeconds(properties.getRecognition().getTimeoutSeconds());

        log.info("Sending {} image(s) with {} enrolled students to recognition service",
                images.size(), students.size());

        RecognitionResult result;
        try {
            result = client.post()
                    .uri("/recognize")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new RecognitionRequest(images, students))
                    .retrieve()
                    .bodyToMono(RecognitionResult.class)
                    .block(timeout);
        } catch (Exception e) {
            log.error("Face recognition request failed: {}", e.getMessage());
            throw new RecognitionServiceException(
                    "Face recognition service is unavailable. Please ensure the recognition server is running.", e);
        }

        if (result == null || result.recognizedStudents() == null) {
            log.error("Face recognition service returned an empty or malformed response");
            throw new RecognitionServiceException("Face recognition service returned a malformed response");
        }

        log.info("Recognition complete: {} students recognized out of {} faces detected",
                result.recognizedStudents().size(), result.totalFacesDetected());
        return result;
    }

    /**
     * Probe GET /health.
     */
    @SuppressWarnings("rawtypes")
    public boolean isAvailable() {
        try {
            Map response = createClient().get()
                    .uri("/health")
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(Duration.ofSeconds(properties.getRecognition().getHealthTimeoutSeconds()));
            return response != null;
        } catch (Exception e) {
            log.debug("Recognition service health probe failed: {}", e.getMessage());
            return false;
        }
    }

    private WebClient createClient() {
        return webClientBuilder.clone()
                .baseUrl(properties.getRecognition().getApiUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    // ========================================================================
    // WIRE TYPES
    // ========================================================================

    /**
     * Reference embedding of one enrolled student.
     */
    public record EnrolledFace(
            Long id,
            String usn,
            String name,
            List<Double> embedding
    ) {}

    public record RecognitionRequest(
            List<String> images,
            @JsonProperty("enrolled_students") List<EnrolledFace> enrolledStudents
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RecognizedStudent(
            String usn,
            String name,
            BigDecimal confidence,
            String emotion,
            String attentiveness
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RecognitionResult(
            @JsonProperty("recognized_students") List<RecognizedStudent> recognizedStudents,
            @JsonProperty("total_faces_detected") int totalFacesDetected,
            @JsonProperty("processed_images") List<String> processedImages,
            String message
    ) {}
}
