package com.supportchat.interfaces.api;

import com.supportchat.application.ChatApplicationService;
import com.supportchat.application.ChatResult;
import com.supportchat.application.ContextAnalysisEngine;
import com.supportchat.interfaces.api.dto.ChatRequest;
import com.supportchat.interfaces.api.dto.ChatResponse;
import com.supportchat.interfaces.api.dto.ErrorResponse;
import com.supportchat.interfaces.api.dto.GreetingResponse;
import com.supportchat.interfaces.api.dto.HistoryResponse;
import com.supportchat.interfaces.api.dto.UserAnalysisResponse;
import com.supportchat.interfaces.api.dto.UserSummaryResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the support chat.
 *
 * Provides endpoints for:
 * - Sending a message and receiving a contextual reply
 * - Reading a user's recent conversation
 * - Reading a user's context analysis and summary
 * - A greeting personalized from the user's context
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Chat", description = "Supportive chat with per-user context analysis")
public class ChatRestController {

    private final ChatApplicationService chatService;
    private final ContextAnalysisEngine engine;

    @PostMapping(
        value = "/chat",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Send a message",
        description = "Analyzes the message in the context of the user's history and returns a reply"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Reply generated",
            content = @Content(schema = @Schema(implementation = ChatResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Another request for this user is still in progress",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Conversation store unavailable",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("Chat request: userId={}", Encode.forJava(request.getUserId()));
        }

        ChatResult result = chatService.chat(request.getUserId(), request.getMessage());
        return ResponseEntity.ok(ChatResponse.from(result));
    }

    @GetMapping(value = "/users/{userId}/history", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Conversation history", description = "Most recent turns, oldest first")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "History returned",
            content = @Content(schema = @Schema(implementation = HistoryResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid user id or limit",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<HistoryResponse> history(
            @PathVariable String userId,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {

        return ResponseEntity.ok(HistoryResponse.of(userId, engine.history(userId, limit)));
    }

    @GetMapping(value = "/users/{userId}/analysis", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "User context analysis", description = "Sentiment trend, topics, engagement and crisis history")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Analysis returned",
            content = @Content(schema = @Schema(implementation = UserAnalysisResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid user id",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<UserAnalysisResponse> analysis(@PathVariable String userId) {
        return ResponseEntity.ok(UserAnalysisResponse.from(engine.describe(userId)));
    }

    @GetMapping(value = "/users/{userId}/summary", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "User summary", description = "Message count and first/last message times")
    public ResponseEntity<UserSummaryResponse> summary(@PathVariable String userId) {
        return ResponseEntity.ok(UserSummaryResponse.from(engine.describe(userId)));
    }

    @GetMapping(value = "/users/{userId}/greeting", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Personalized greeting")
    public ResponseEntity<GreetingResponse> greeting(@PathVariable String userId) {
        return ResponseEntity.ok(GreetingResponse.builder()
            .userId(userId)
            .greeting(chatService.greeting(userId))
            .build());
    }
}
