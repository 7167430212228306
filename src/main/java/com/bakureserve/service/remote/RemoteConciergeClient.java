package com.bakureserve.service.remote;

import com.bakureserve.config.ConciergeProperties;
import com.bakureserve.dto.remote.RemoteConciergeRequest;
import com.bakureserve.dto.remote.RemoteConciergeResponse;
import com.bakureserve.dto.remote.RemoteConciergeResult;
import com.bakureserve.exception.RemoteConciergeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 원격 랭킹 서비스 단건 호출
 * 모든 실패는 {@link RemoteConciergeException}으로 변환 (재시도/인증은 여기서 다루지 않음)
 */
@Service
public class RemoteConciergeClient {

    private static final Logger logger = LoggerFactory.getLogger(RemoteConciergeClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpointUrl;

    public RemoteConciergeClient(RestTemplate conciergeRestTemplate,
                                 ObjectMapper objectMapper,
                                 ConciergeProperties properties) {
        this.restTemplate = conciergeRestTemplate;
        this.objectMapper = objectMapper;
        this.endpointUrl = properties.getRemote().getBaseUrl() + properties.getRemote().getPath();
    }

    public RemoteConciergeResponse fetchConcierge(String text, int limit) {
        logger.info("[RemoteConciergeClient] fetchConcierge START - url: {}, limit: {}", endpointUrl, limit);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<RemoteConciergeRequest> request = new HttpEntity<>(new RemoteConciergeRequest(text, limit), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(endpointUrl, request, String.class);
        } catch (HttpClientErrorException | HttpServerErrorException e) {
            throw new RemoteConciergeException("Concierge ranker returned " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new RemoteConciergeException("Concierge ranker unreachable: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new RemoteConciergeException("Concierge ranker returned " + response.getStatusCode());
        }
        if (response.getBody() == null || response.getBody().isBlank()) {
            throw new RemoteConciergeException("Concierge ranker returned an empty body");
        }

        RemoteConciergeResponse payload;
        try {
            payload = objectMapper.readValue(response.getBody(), RemoteConciergeResponse.class);
        } catch (JsonProcessingException e) {
            throw new RemoteConciergeException("Concierge ranker returned malformed JSON", e);
        }
        validate(payload);

        logger.info("[RemoteConciergeClient] fetchConcierge SUCCESS - results: {}, mode: {}",
                payload.getResults().size(), payload.getMode());
        return payload;
    }

    /**
     * 페이로드 검증 (results 필수, 각 결과는 id/name 필수)
     */
    private void validate(RemoteConciergeResponse payload) {
        if (payload == null || payload.getResults() == null) {
            throw new RemoteConciergeException("Concierge ranker payload has no results");
        }
        for (RemoteConciergeResult result : payload.getResults()) {
            if (result == null || isBlank(result.getId()) || isBlank(result.getName())) {
                throw new RemoteConciergeException("Concierge ranker result is missing id or name: " + result);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
