package com.touchline.matchdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.touchline.exception.SnapshotFetchException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Thin REST client for the API-Football v3 endpoints used by the alert engine.
 *
 * <p>Each method makes exactly one HTTP call and returns the {@code response} array of
 * the body. Failures are raised as {@link SnapshotFetchException}; retrying is the
 * caller's job.
 */
@Component
public class ApiFootballClient {

    private static final Logger log = LoggerFactory.getLogger(ApiFootballClient.class);

    static final String API_KEY_HEADER = "x-apisports-key";
    static final String LIVE_FIXTURES_PATH = "/fixtures?live=all";
    static final String STATISTICS_PATH = "/fixtures/statistics?fixture={fixtureId}";

    private final SportsApiConfig sportsApiConfig;
    private final RestTemplate restTemplate;

    public ApiFootballClient(SportsApiConfig sportsApiConfig, @Qualifier("sportsApiRestTemplate") RestTemplate restTemplate) {
        this.sportsApiConfig = sportsApiConfig;
        this.restTemplate = restTemplate;
    }

    /** All fixtures currently in play. */
    public JsonNode getLiveFixtures() {
        return get(LIVE_FIXTURES_PATH, null);
    }

    /** Per-team statistics of one fixture; usually two entries, home first. */
    public JsonNode getFixtureStatistics(String fixtureId) {
        return get(STATISTICS_PATH, fixtureId);
    }

    private JsonNode get(String path, String fixtureId) {
        String url = sportsApiConfig.getBaseUrl() + path;
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, sportsApiConfig.getApiKey());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<JsonNode> response;
        try {
            response = fixtureId == null
                    ? restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class)
                    : restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class, fixtureId);
        } catch (RestClientResponseException e) {
            throw SnapshotFetchException.forStatus(path, e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new SnapshotFetchException("Upstream call failed: " + path, e);
        }

        JsonNode body = response.getBody();
        if (body == null || !body.path("response").isArray()) {
            throw new SnapshotFetchException("Upstream body has no response array: " + path);
        }
        JsonNode errors = body.path("errors");
        if (errors.isObject() && errors.size() > 0) {
            log.warn("API-Football reported errors for {}: {}", path, errors);
        }
        return body.get("response");
    }
}
