package com.heronix.attendance.adapter.inference;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.StageInvocationException;
import com.heronix.attendance.model.enums.StageType;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpInferenceStageClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private HttpInferenceStageClient clientAnswering(HttpStatus status, String body) {
        AttendanceProperties properties = new AttendanceProperties();
        properties.getAnalytics().setBaseUrl("http://inference:8000");
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new HttpInferenceStageClient(builder, properties);
    }

    @Test
    void extractsTheStageOutputField() {
        HttpInferenceStageClient client = clientAnswering(HttpStatus.OK, "{\"trend\":\"improving\"}");

        StepVerifier.create(client.invokeAsync(StageType.TREND, List.of()))
                .expectNext("improving")
                .verifyComplete();

        assertThat(requests).singleElement()
                .satisfies(r -> assertThat(r.url().toString()).isEqualTo("http://inference:8000/stages/trend"));
    }

    @Test
    void completesEmptyWithoutTheOutputField() {
        HttpInferenceStageClient client = clientAnswering(HttpStatus.OK, "{\"other\":\"x\"}");

        StepVerifier.create(client.invokeAsync(StageType.RISK, Map.of()))
                .verifyComplete();
        assertThat(client.invoke(StageType.RISK, Map.of())).isNull();
    }

    @Test
    void transportErrorsBecomeStageFailures() {
        HttpInferenceStageClient client = clientAnswering(HttpStatus.BAD_GATEWAY, "{}");

        assertThatThrownBy(() -> client.invoke(StageType.CONSISTENCY, List.of()))
                .isInstanceOf(StageInvocationException.class)
                .satisfies(e -> assertThat(((StageInvocationException) e).getStage()).isEqualTo(StageType.CONSISTENCY));
    }
}
