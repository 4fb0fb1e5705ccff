package com.heronix.attendance.adapter.inference;

import java.time.Duration;
import java.util.Map;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.StageInvocationException;
import com.heronix.attendance.model.enums.StageTransport;
import com.heronix.attendance.model.enums.StageType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Stage client that calls the remote inference service:
 * POST {base-url}/stages/{stage} with the payload as body.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpInferenceStageClient implements InferenceStageClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient.Builder webClientBuilder;
    private final AttendanceProperties properties;

    @Override
    public StageTransport getTransport() {
        return StageTransport.HTTP;
    }

    @Override
    public String invoke(StageType stage, Object payload) {
        Duration timeout = Duration.ofSeconds(properties.getAnalytics().getStageTimeoutSeconds());
        try {
            return invokeAsync(stage, payload).block(timeout);
        } catch (StageInvocationException e) {
            throw e;
        } catch (Exception e) {
            throw new StageInvocationException(stage, e.getMessage(), e);
        }
    }

    /**
     * Reactive form of {@link #invoke}; completes empty when the answer lacks the output field.
     */
    public Mono<String> invokeAsync(StageType stage, Object payload) {
        log.debug("Invoking {} stage over http", stage.getOutputField());

        return createClient().post()
                .uri("/stages/{stage}", stage.getOutputField())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .flatMap(body -> {
                    Object value = body.get(stage.getOutputField());
                    return value != null ? Mono.just(value.toString()) : Mono.empty();
                });
    }

    private WebClient createClient() {
        return webClientBuilder.clone()
                .baseUrl(properties.getAnalytics().getBaseUrl())
                .build();
    }
}
