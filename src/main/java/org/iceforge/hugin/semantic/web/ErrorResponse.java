package org.iceforge.hugin.semantic.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {
    private final Instant timestamp = Instant.now();
    private final String error;
    private final String detail;
    private final List<String> violations;

    public ErrorResponse(String error, String detail) {
        this(error, detail, List.of());
    }

    public ErrorResponse(String error, String detail, List<String> violations) {
        this.error = error;
        this.detail = detail;
        this.violations = List.copyOf(violations);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    public List<String> getViolations() {
        return violations;
    }
}
