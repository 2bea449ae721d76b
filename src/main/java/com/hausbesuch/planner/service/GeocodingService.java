package com.hausbesuch.planner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hausbesuch.planner.planning.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Resolves postal addresses to coordinates with an OpenStreetMap Nominatim endpoint.
 * Failures never propagate: callers get an empty result and decide how to warn the user.
 */
@Service
public class GeocodingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeocodingService.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String baseUrl;
    private final String userAgent;
    private final String addressSuffix;

    public GeocodingService(RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            @Value("${geocoding.enabled:true}") boolean enabled,
                            @Value("${geocoding.base-url:https://nominatim.openstreetmap.org}") String baseUrl,
                            @Value("${geocoding.user-agent:visit-planner}") String userAgent,
                            @Value("${geocoding.address-suffix:}") String addressSuffix) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.baseUrl = baseUrl;
        this.userAgent = userAgent;
        this.addressSuffix = addressSuffix != null ? addressSuffix : "";
    }

    public Optional<GeoPoint> resolve(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        if (!enabled) {
            LOGGER.debug("Geocoding disabled, '{}' left without coordinates", address);
            return Optional.empty();
        }

        String query = address.trim() + addressSuffix;
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/search")
                .queryParam("q", query)
                .queryParam("format", "json")
                .queryParam("limit", 1)
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, userAgent);

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                LOGGER.warn("Geocoding of '{}' failed with status {}", query, response.getStatusCode());
                return Optional.empty();
            }
            return parseFirstHit(response.getBody(), query);
        } catch (RestClientException e) {
            LOGGER.warn("Geocoding request for '{}' failed: {}", query, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<GeoPoint> parseFirstHit(String body, String query) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!root.isArray() || root.isEmpty()) {
                LOGGER.info("No geocoding result for '{}'", query);
                return Optional.empty();
            }
            JsonNode hit = root.get(0);
            double latitude = Double.parseDouble(hit.path("lat").asText());
            double longitude = Double.parseDouble(hit.path("lon").asText());
            GeoPoint point = new GeoPoint(latitude, longitude);
            return point.isValid() ? Optional.of(point) : Optional.empty();
        } catch (IOException | NumberFormatException e) {
            LOGGER.warn("Unreadable geocoding response for '{}': {}", query, e.getMessage());
            return Optional.empty();
        }
    }
}
