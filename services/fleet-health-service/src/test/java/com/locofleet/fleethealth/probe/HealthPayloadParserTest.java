package com.locofleet.fleethealth.probe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locofleet.common.exception.MalformedHealthPayloadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HealthPayloadParser")
class HealthPayloadParserTest {

    private final HealthPayloadParser parser = new HealthPayloadParser(new ObjectMapper());

    @Nested
    @DisplayName("well-formed payloads")
    class WellFormed {

        @Test
        @DisplayName("reads every section of a full agent report")
        void shouldParseFullReport() {
            String body = """
                {
                  "qemu_healthy": true,
                  "overall_status": "healthy",
                  "video": {"vnc_available": true, "estimated_frame_rate": 24.5},
                  "audio": {"pulse_running": true},
                  "performance": {"cpu_usage": 42.0, "memory_usage": 61.5},
                  "network": {"bridge_up": true, "tap_up": true, "tx_error_rate": 0.2},
                  "issues": ["none"]
                }
                """;

            HealthPayload payload = parser.parse(body);

            assertThat(payload.getQemuHealthy()).isTrue();
            assertThat(payload.getOverallStatus()).isEqualTo("healthy");
            assertThat(payload.video()).contains(new HealthPayload.Video(true, 24.5));
            assertThat(payload.audio()).contains(new HealthPayload.Audio(true));
            assertThat(payload.performance()).contains(new HealthPayload.Performance(42.0, 61.5));
            assertThat(payload.network()).contains(new HealthPayload.Network(true, true, 0.2));
            assertThat(payload.getReportedIssues()).containsExactly("none");
        }

        @Test
        @DisplayName("leaves absent sections empty")
        void shouldTreatMissingSectionsAsNotReported() {
            HealthPayload payload = parser.parse("{\"qemu_healthy\": false}");

            assertThat(payload.getQemuHealthy()).isFalse();
            assertThat(payload.video()).isEmpty();
            assertThat(payload.audio()).isEmpty();
            assertThat(payload.performance()).isEmpty();
            assertThat(payload.network()).isEmpty();
            assertThat(payload.getReportedIssues()).isEmpty();
        }

        @Test
        @DisplayName("accepts numeric strings with unit suffixes and textual or numeric booleans")
        void shouldParseLenientValues() {
            String body = """
                {
                  "qemu_healthy": "true",
                  "performance": {"cpu_usage": "87.5%", "memory_usage": "n/a"},
                  "network": {"bridge_up": 1, "tap_up": 0, "tx_error_rate": "3"}
                }
                """;

            HealthPayload payload = parser.parse(body);

            assertThat(payload.getQemuHealthy()).isTrue();
            assertThat(payload.performance()).contains(new HealthPayload.Performance(87.5, null));
            assertThat(payload.network()).contains(new HealthPayload.Network(true, false, 3.0));
        }

        @Test
        @DisplayName("treats null fields as not reported")
        void shouldTreatNullAsMissing() {
            HealthPayload payload = parser.parse("{\"qemu_healthy\": null, \"video\": null}");

            assertThat(payload.getQemuHealthy()).isNull();
            assertThat(payload.video()).isEmpty();
        }
    }

    @Nested
    @DisplayName("malformed payloads")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "not json", "[1, 2]", "\"healthy\""})
        @DisplayName("rejects bodies that are not a JSON object")
        void shouldRejectNonObjects(String body) {
            assertThatThrownBy(() -> parser.parse(body))
                .isInstanceOf(MalformedHealthPayloadException.class);
        }

        @Test
        @DisplayName("rejects a section that is not an object")
        void shouldRejectScalarSection() {
            assertThatThrownBy(() -> parser.parse("{\"qemu_healthy\": true, \"network\": \"up\"}"))
                .isInstanceOf(MalformedHealthPayloadException.class)
                .hasMessageContaining("network");
        }

        @Test
        @DisplayName("rejects a structured value where a number is expected")
        void shouldRejectStructuredNumber() {
            assertThatThrownBy(() -> parser.parse("{\"performance\": {\"cpu_usage\": {\"value\": 1}}}"))
                .isInstanceOf(MalformedHealthPayloadException.class)
                .hasMessageContaining("cpu_usage");
        }

        @Test
        @DisplayName("rejects a structured value where a boolean is expected")
        void shouldRejectStructuredBoolean() {
            assertThatThrownBy(() -> parser.parse("{\"qemu_healthy\": [true]}"))
                .isInstanceOf(MalformedHealthPayloadException.class)
                .hasMessageContaining("qemu_healthy");
        }
    }
}
