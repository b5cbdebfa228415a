package com.locofleet.fleethealth.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every API endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String errorCode;

    private String message;

    private int status;

    private Instant timestamp;

    /**
     * Request path that caused the error
     */
    private String path;

    private Map<String, Object> metadata;
}
