package com.kuruswap.api.controller;

import com.kuruswap.api.dto.ConversationRequest;
import com.kuruswap.api.dto.ConversationResponse;
import com.kuruswap.session.ConversationStateMachine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Conversation endpoint for a messaging front end. Rejections are returned with 200 and
 * {@code rejected=true}; the front end renders the prompt.
 */
@RestController
@RequestMapping("/api/v1/users/{userId}/conversation")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationStateMachine conversationStateMachine;

    @PostMapping
    public Mono<ResponseEntity<ConversationResponse>> handle(
            @PathVariable long userId,
            @Valid @RequestBody ConversationRequest request
    ) {
        return Mono.fromCallable(() -> conversationStateMachine.handle(userId, request.displayName(), request.toSessionInput()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(ConversationResponse.from(result)));
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> state(@PathVariable long userId) {
        return ResponseEntity.ok(Map.of("state", conversationStateMachine.currentState(userId).name()));
    }
}
