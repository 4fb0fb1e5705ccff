package com.heronix.attendance.adapter.recognition;

import com.heronix.attendance.adapter.recognition.FaceRecognitionClient.EnrolledFace;
import com.heronix.attendance.adapter.recognition.FaceRecognitionClient.RecognitionResult;
import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.RecognitionServiceException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FaceRecognitionClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private FaceRecognitionClient clientAnswering(HttpStatus status, String body) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        };
        AttendanceProperties properties = new AttendanceProperties();
        properties.getRecognition().setApiUrl("http://recognizer:8000");
        return new FaceRecognitionClient(WebClient.builder().exchangeFunction(exchange), properties);
    }

    private static List<EnrolledFace> faces() {
        return List.of(new EnrolledFace(1L, "1CS21001", "Asha", List.of(0.1, 0.2)));
    }

    @Test
    void parsesRecognizedStudents() {
        FaceRecognitionClient client = clientAnswering(HttpStatus.OK, """
                {"recognized_students":[{"usn":"1CS21001","name":"Asha","confidence":0.9132,
                  "emotion":"happy","attentiveness":"attentive","bbox":[1,2,3,4]}],
                 "total_faces_detected":3,"processed_images":[],"message":"done"}
                """);

        RecognitionResult result = client.recognize(List.of("aW1hZ2U="), faces());

        assertThat(result.totalFacesDetected()).isEqualTo(3);
        assertThat(result.recognizedStudents()).singleElement().satisfies(s -> {
            assertThat(s.usn()).isEqualTo("1CS21001");
            assertThat(s.confidence()).isEqualByComparingTo("0.9132");
        });
        assertThat(requests).singleElement().satisfies(r -> {
            assertThat(r.method()).isEqualTo(HttpMethod.POST);
            assertThat(r.url().toString()).isEqualTo("http://recognizer:8000/recognize");
        });
    }

    @Test
    void serverErrorIsAHardFailure() {
        FaceRecognitionClient client = clientAnswering(HttpStatus.INTERNAL_SERVER_ERROR, "{\"detail\":\"boom\"}");

        assertThatThrownBy(() -> client.recognize(List.of("aW1hZ2U="), faces()))
                .isInstanceOf(RecognitionServiceException.class)
                .hasMessageContaining("unavailable");
    }

    @Test
    void bodyWithoutRecognizedStudentsIsMalformed() {
        FaceRecognitionClient client = clientAnswering(HttpStatus.OK, "{\"message\":\"no faces\"}");

        assertThatThrownBy(() -> client.recognize(List.of("aW1hZ2U="), faces()))
                .isInstanceOf(RecognitionServiceException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void healthProbeReportsAvailability() {
        assertThat(clientAnswering(HttpStatus.OK, "{\"status\":\"healthy\"}").isAvailable()).isTrue();
        assertThat(clientAnswering(HttpStatus.SERVICE_UNAVAILABLE, "{}").isAvailable()).isFalse();
    }
}
