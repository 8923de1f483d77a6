package com.nestfind.backend.global.realtime;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.nestfind.backend.modules.auth.application.AuthenticatedUser;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
public class UserEventStreamController {

    private static final long STREAM_TIMEOUT_MS = 30 * 60 * 1000L;

    private final UserEventRegistry userEventRegistry;

    public UserEventStreamController(UserEventRegistry userEventRegistry) {
        this.userEventRegistry = userEventRegistry;
    }

    @Operation(summary = "Stream security events (session revocation) for the current user")
    @GetMapping(path = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@AuthenticationPrincipal AuthenticatedUser principal) {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        UserEventRegistry.Subscription subscription = userEventRegistry.subscribe(
                principal.userId(),
                event -> {
                    try {
                        emitter.send(SseEmitter.event().name(event).data(event));
                    } catch (IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                },
                emitter::complete
        );
        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(subscription::cancel);
        emitter.onError(error -> subscription.cancel());
        return emitter;
    }
}
