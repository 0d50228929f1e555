package io.pipe.core.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolResponse(String status, String message) {
    public static final String SUCCEEDED = "succeeded";
    public static final String EXPIRED_MESSAGE = "This tool response has expired to save tokens.";

    public ToolResponse {
        status = status == null ? "" : status;
        message = message == null ? "" : message;
    }

    public boolean succeeded() {
        return SUCCEEDED.equals(status);
    }

    public ToolResponse expired() {
        return new ToolResponse(status, EXPIRED_MESSAGE);
    }
}
