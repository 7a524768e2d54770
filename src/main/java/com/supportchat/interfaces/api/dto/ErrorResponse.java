package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Error body returned by every failing endpoint.
 *
 * <p>{@code detail} is a fixed, user-safe sentence; submitted message text is
 * never echoed back. {@code invalid_fields} is present only for validation
 * failures and names fields as they appear in the request JSON.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    UUID requestId;
    Instant timestamp;
    int status;
    String error;
    String detail;
    String path;
    @Singular
    List<InvalidField> invalidFields;

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class InvalidField {
        String field;
        String reason;
    }
}
