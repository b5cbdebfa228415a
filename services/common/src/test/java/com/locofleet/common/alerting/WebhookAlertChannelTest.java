package com.locofleet.common.alerting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("WebhookAlertChannel")
class WebhookAlertChannelTest {

    private static final String URL = "http://alerts.local/hook";

    private final Alert alert = Alert.builder()
        .id("alert-1")
        .timestamp(Instant.parse("2025-06-01T12:00:00Z"))
        .severity(AlertSeverity.CRITICAL)
        .message("Instance instance-0 health score critical: 40")
        .instanceId("instance-0")
        .service("lego-loco-cluster")
        .meta(Map.of("score", 40))
        .build();

    @Test
    @DisplayName("posts the alert as flat JSON")
    void shouldPostFlatJson() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.id").value("alert-1"))
            .andExpect(jsonPath("$.severity").value("critical"))
            .andExpect(jsonPath("$.instanceId").value("instance-0"))
            .andExpect(jsonPath("$.score").value(40))
            .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        new WebhookAlertChannel(URL, restTemplate).dispatch(alert);

        server.verify();
    }

    @Test
    @DisplayName("fails on a non-2xx response")
    void shouldFailOnErrorStatus() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> new WebhookAlertChannel(URL, restTemplate).dispatch(alert))
            .isInstanceOf(AlertDeliveryException.class);
    }

    @Test
    @DisplayName("is disabled without a URL")
    void shouldBeDisabledWithoutUrl() {
        assertThat(new WebhookAlertChannel(" ", new RestTemplate()).isEnabled()).isFalse();
        assertThat(new WebhookAlertChannel(URL, new RestTemplate()).isEnabled()).isTrue();
    }
}
