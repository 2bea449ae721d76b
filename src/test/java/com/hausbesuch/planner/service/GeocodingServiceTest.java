package com.hausbesuch.planner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hausbesuch.planner.planning.GeoPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GeocodingServiceTest {

    private static final String HIT = "[{\"lat\":\"49.7924\",\"lon\":\"9.9329\",\"display_name\":\"Würzburg\"}]";

    @Mock
    private RestTemplate restTemplate;

    private GeocodingService service(boolean enabled) {
        return new GeocodingService(restTemplate, new ObjectMapper(), enabled,
                "https://nominatim.example.org", "visit-planner-test", ", Germany");
    }

    @Test
    void firstHitIsReturnedAndSuffixIsAppended() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok(HIT));

        Optional<GeoPoint> result = service(true).resolve("Domstraße 1");

        assertThat(result).contains(new GeoPoint(49.7924, 9.9329));
        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(restTemplate).exchange(uri.capture(), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class));
        assertThat(uri.getValue().getPath()).isEqualTo("/search");
        assertThat(uri.getValue().getQuery()).contains("Domstraße 1, Germany").contains("limit=1");
    }

    @Test
    void emptyResultGivesNoCoordinates() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok("[]"));

        assertThat(service(true).resolve("Unbekannt 0")).isEmpty();
    }

    @Test
    void networkAndServerErrorsAreSwallowed() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("timeout"));
        assertThat(service(true).resolve("Domstraße 1")).isEmpty();

        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("busy"));
        assertThat(service(true).resolve("Domstraße 1")).isEmpty();
    }

    @Test
    void malformedResponsesAreIgnored() {
        GeocodingService service = service(true);

        assertThat(service.parseFirstHit("not json", "q")).isEmpty();
        assertThat(service.parseFirstHit("[{\"lat\":\"north\",\"lon\":\"9.9\"}]", "q")).isEmpty();
        assertThat(service.parseFirstHit("[{\"lat\":\"95.0\",\"lon\":\"9.9\"}]", "q")).isEmpty();
    }

    @Test
    void disabledServiceNeverCallsOut() {
        assertThat(service(false).resolve("Domstraße 1")).isEmpty();
        assertThat(service(true).resolve("  ")).isEmpty();

        verify(restTemplate, never()).exchange(any(URI.class), any(HttpMethod.class), any(HttpEntity.class), eq(String.class));
    }
}
