package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for one chat turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatRequest {

    @NotBlank(message = "User id is required")
    @Size(max = 128, message = "User id must not exceed 128 characters")
    @Pattern(regexp = "[A-Za-z0-9._:@-]+", message = "User id contains unsupported characters")
    private String userId;

    @NotNull(message = "Message is required")
    @Size(max = 8000, message = "Message must not exceed 8000 characters")
    private String message;
}
