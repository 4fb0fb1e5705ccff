package com.heronix.attendance.config;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.heronix.attendance.adapter.inference.InferenceStageClient;
import com.heronix.attendance.model.enums.StageTransport;

/**
 * Configuration for inference stage clients.
 *
 * Registers all available InferenceStageClient implementations and provides
 * them as a Map indexed by transport; the pipeline picks the one named by
 * heronix.attendance.analytics.transport.
 *
 * @author Heronix Development Team
 */
@Configuration
public class InferenceStageConfig {

    /**
     * Create a map of stage clients indexed by transport.
     *
     * @param clients all available InferenceStageClient beans
     * @return map of StageTransport -> InferenceStageClient
     */
    @Bean
    public Map<StageTransport, InferenceStageClient> inferenceStageClients(List<InferenceStageClient> clients) {
        Map<StageTransport, InferenceStageClient> clientMap = new EnumMap<>(StageTransport.class);

        for (InferenceStageClient client : clients) {
            clientMap.put(client.getTransport(), client);
        }

        return clientMap;
    }
}
