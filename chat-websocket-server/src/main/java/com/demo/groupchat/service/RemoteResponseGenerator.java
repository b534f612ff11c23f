package com.demo.groupchat.service;

import com.demo.groupchat.domain.HistoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Delegates reply generation to an external AI service over HTTP.
 * <p>
 * Request: {@code {"history": [{role, content}...], "message": "..."}};
 * expected response: {@code {"response": "..."}}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "chat.ai.provider", havingValue = "remote")
public class RemoteResponseGenerator implements ResponseGenerator {

    private final RestTemplate restTemplate;
    private final String serviceUrl;

    public RemoteResponseGenerator(RestTemplate restTemplate,
                                   @Value("${chat.ai.remote.url:http://ai-service:8000/generate}") String serviceUrl) {
        this.restTemplate = restTemplate;
        this.serviceUrl = serviceUrl;
        log.info("RemoteResponseGenerator initialized: url={}", serviceUrl);
    }

    @Override
    @SuppressWarnings("rawtypes")
    public String generateResponse(List<HistoryEntry> history, String message) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<Map<String, Object>> entity = new HttpEntity<>(
                    Map.of("history", history, "message", message), headers);

            ResponseEntity<Map> response = restTemplate.postForEntity(serviceUrl, entity, Map.class);
            Object reply = response.getBody() != null ? response.getBody().get("response") : null;

            if (!(reply instanceof String text) || text.isBlank()) {
                log.warn("AI service returned no reply: status={}", response.getStatusCode());
                return APOLOGY;
            }
            return text;

        } catch (RestClientException e) {
            log.error("AI service call failed: url={}", serviceUrl, e);
            return APOLOGY;
        }
    }
}
