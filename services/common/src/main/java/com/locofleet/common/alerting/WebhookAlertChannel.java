package com.locofleet.common.alerting;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts alerts as flat JSON to {@code fleet.alerting.webhook.url}. Disabled when no URL is set.
 */
@Slf4j
@Component
public class WebhookAlertChannel implements AlertChannel {

    private final String webhookUrl;
    private final RestTemplate restTemplate;

    public WebhookAlertChannel(AlertingProperties properties, RestTemplateBuilder restTemplateBuilder) {
        this(properties.getWebhook().getUrl(), restTemplateBuilder
            .setConnectTimeout(properties.getWebhook().getTimeout())
            .setReadTimeout(properties.getWebhook().getTimeout())
            .build());
    }

    WebhookAlertChannel(String webhookUrl, RestTemplate restTemplate) {
        this.webhookUrl = webhookUrl;
        this.restTemplate = restTemplate;
    }

    @Override
    public String getName() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public void dispatch(Alert alert) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(webhookUrl, new HttpEntity<>(toPayload(alert), headers), String.class);
        } catch (RestClientException e) {
            throw new AlertDeliveryException("Webhook delivery failed for alert " + alert.getId(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new AlertDeliveryException("Webhook returned " + response.getStatusCode().value()
                + " for alert " + alert.getId());
        }
        log.debug("Alert {} delivered to webhook", alert.getId());
    }

    static Map<String, Object> toPayload(Alert alert) {
        Map<String, Object> payload = new LinkedHashMap<>(alert.getMeta());
        payload.put("id", alert.getId());
        payload.put("timestamp", alert.getTimestamp().toString());
        payload.put("severity", alert.getSeverity().name().toLowerCase());
        payload.put("message", alert.getMessage());
        payload.put("instanceId", alert.getInstanceId());
        payload.put("service", alert.getService());
        return payload;
    }
}
