package com.osa.aggregator.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class BackendConfig {
    private static final Logger logger = LoggerFactory.getLogger(BackendConfig.class);

    /**
     * Pairs every configured backend with its client. Client beans win over
     * the generic REST client; a backend with neither is skipped.
     */
    @Bean
    public BackendRegistry backendRegistry(
        BackendProperties properties,
        ObjectProvider<SearchBackend> clientBeans,
        RestTemplateBuilder restTemplateBuilder,
        ObjectMapper objectMapper
    ) {
        Map<String, SearchBackend> clientsById = new HashMap<>();
        clientBeans.orderedStream().forEach(client -> clientsById.put(client.id(), client));

        List<Backend> backends = new ArrayList<>();
        for (Map.Entry<String, BackendProperties.Settings> entry : properties.getBackends().entrySet()) {
            String id = entry.getKey();
            BackendProperties.Settings settings = entry.getValue();
            SearchBackend client = clientsById.get(id);
            if (client == null && settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()) {
                client = new RestSearchBackend(
                    id,
                    restTemplate(restTemplateBuilder, settings.getTimeoutMs()),
                    objectMapper,
                    settings.getBaseUrl(),
                    settings.getPath()
                );
            }
            if (client == null) {
                logger.warn("backend_skipped backend={} reason=no_client", id);
                continue;
            }
            backends.add(
                new Backend(
                    id,
                    settings.getPriority(),
                    settings.getRateLimit(),
                    settings.getTimeoutMs(),
                    settings.getRetryAttempts(),
                    settings.isEnabled(),
                    client
                )
            );
            logger.info(
                "backend_registered backend={} enabled={} priority={} rate_limit={} timeout_ms={}",
                id,
                settings.isEnabled(),
                settings.getPriority(),
                settings.getRateLimit(),
                settings.getTimeoutMs()
            );
        }
        return new BackendRegistry(backends);
    }

    private RestTemplate restTemplate(RestTemplateBuilder builder, long timeoutMs) {
        return builder
            .setConnectTimeout(Duration.ofMillis(timeoutMs))
            .setReadTimeout(Duration.ofMillis(timeoutMs))
            .build();
    }
}
