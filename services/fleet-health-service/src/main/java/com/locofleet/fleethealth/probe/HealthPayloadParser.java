package com.locofleet.fleethealth.probe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locofleet.common.exception.MalformedHealthPayloadException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates the agent's JSON at the boundary and maps it onto {@link HealthPayload}.
 * <p>
 * Numbers are accepted as JSON numbers or numeric strings with an optional unit suffix
 * ({@code "45.2%"}). Booleans are accepted as JSON booleans, {@code "true"/"false"} or 0/1.
 */
@Component
public class HealthPayloadParser {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([-+]?\\d+(?:\\.\\d+)?)");

    private final ObjectMapper objectMapper;

    public HealthPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MalformedHealthPayloadException when the body is not a JSON object or a section has the wrong shape
     */
    public HealthPayload parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedHealthPayloadException("Empty health payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedHealthPayloadException("Health payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public HealthPayload parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedHealthPayloadException("Health payload must be a JSON object");
        }

        HealthPayload.HealthPayloadBuilder builder = HealthPayload.builder()
            .qemuHealthy(bool(root, "qemu_healthy"))
            .overallStatus(text(root, "overall_status"))
            .reportedIssues(issues(root));

        JsonNode video = section(root, "video");
        if (video != null) {
            builder.video(new HealthPayload.Video(bool(video, "vnc_available"), number(video, "estimated_frame_rate")));
        }
        JsonNode audio = section(root, "audio");
        if (audio != null) {
            builder.audio(new HealthPayload.Audio(bool(audio, "pulse_running")));
        }
        JsonNode performance = section(root, "performance");
        if (performance != null) {
            builder.performance(new HealthPayload.Performance(
                number(performance, "cpu_usage"), number(performance, "memory_usage")));
        }
        JsonNode network = section(root, "network");
        if (network != null) {
            builder.network(new HealthPayload.Network(
                bool(network, "bridge_up"), bool(network, "tap_up"), number(network, "tx_error_rate")));
        }
        return builder.build();
    }

    private static JsonNode section(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new MalformedHealthPayloadException("Section '" + name + "' must be an object");
        }
        return node;
    }

    private static Boolean bool(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0;
        }
        if (node.isTextual()) {
            return Boolean.parseBoolean(node.textValue().trim());
        }
        throw new MalformedHealthPayloadException("Field '" + field + "' must be a boolean");
    }

    static Double number(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            Matcher matcher = LEADING_NUMBER.matcher(node.textValue());
            return matcher.find() ? Double.valueOf(matcher.group(1)) : null;
        }
        throw new MalformedHealthPayloadException("Field '" + field + "' must be numeric");
    }

    private static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static List<String> issues(JsonNode root) {
        JsonNode node = root.get("issues");
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> issues = new ArrayList<>();
        node.forEach(issue -> issues.add(issue.asText()));
        return List.copyOf(issues);
    }
}
