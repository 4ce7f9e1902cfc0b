package com.nosota.mshop.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of every error response.
 * <p>
 * {@code details} carries extra figures for the client (e.g. required amount and current
 * balance on an insufficient-balance failure) and is omitted when empty.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
public class ErrorResponse {

    private Instant timestamp;
    private int status;
    private String error;
    private String message;
    private String path;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> details = new LinkedHashMap<>();

    public static ErrorResponse of(int status, String error, String message, String path) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now());
        response.setStatus(status);
        response.setError(error);
        response.setMessage(message);
        response.setPath(path);
        return response;
    }

    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }
}
