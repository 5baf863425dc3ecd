package me.golemcore.relay.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.relay.domain.model.AggregatedRequest;
import me.golemcore.relay.domain.model.GenerationException;
import me.golemcore.relay.domain.model.GenerationFailureKind;
import me.golemcore.relay.domain.model.GenerationRequest;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.i18n.MessageService;
import me.golemcore.relay.port.outbound.GenerationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends a request whose quiet period elapsed to the generation service and
 * delivers the outcome to the owner.
 *
 * <p>
 * {@link #dispatch} runs on the event loop. Everything up to and including the
 * credential pick is synchronous; the generation call then leaves the loop and
 * its completion only delivers notices. Every failure ends in exactly one
 * failure notice for that request id: no retry, no requeue, no effect on other
 * owners or on the rotator.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchService {

    private static final String PARAGRAPH_BREAK = "\n\n";

    private final PendingRequestStore store;
    private final KeyRotator keyRotator;
    private final GenerationPort generationPort;
    private final OwnerNotifier notifier;
    private final MessageService messageService;
    private final BotProperties properties;

    /**
     * Dispatches {@code requestId} if it is still the owner's current request.
     * The returned future completes once the final notice was handed to the
     * channel; it never completes exceptionally.
     */
    public CompletableFuture<Void> dispatch(String owner, String requestId) {
        Optional<AggregatedRequest> taken = store.take(owner, requestId);
        if (taken.isEmpty()) {
            log.debug("[Dispatch] Request {} superseded or cancelled, nothing to send", requestId);
            return CompletableFuture.completedFuture(null);
        }
        AggregatedRequest request = taken.get();

        notifier.notify(owner, messageService.getMessage("dispatch.started", requestId));

        String credential = keyRotator.next();
        GenerationRequest generationRequest = GenerationRequest.builder()
                .requestId(requestId)
                .text(buildPrompt(request.getText()))
                .credential(credential)
                .build();

        log.info("[Dispatch] Sending request {} to {}", requestId, generationPort.getProviderId());
        Duration timeout = properties.getGeneration().getTimeout();
        return startGeneration(generationRequest)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((text, error) -> {
                    if (error == null) {
                        log.info("[Dispatch] Request {} answered ({} chars)", requestId, text.length());
                        notifier.notify(owner, messageService.getMessage("dispatch.response", requestId, text));
                    } else {
                        notifier.notify(owner, describeFailure(requestId, error));
                    }
                    return null;
                });
    }

    private CompletableFuture<String> startGeneration(GenerationRequest request) {
        try {
            return generationPort.generate(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String buildPrompt(String text) {
        String prefix = properties.getAggregation().getInstructionPrefix();
        if (prefix == null || prefix.isBlank()) {
            return text;
        }
        return prefix.strip() + PARAGRAPH_BREAK + text;
    }

    private String describeFailure(String requestId, Throwable error) {
        Throwable cause = unwrap(error);
        String reason;
        if (cause instanceof TimeoutException) {
            log.error("[Dispatch] Request {} timed out after {}", requestId,
                    properties.getGeneration().getTimeout());
            reason = describeKind(GenerationFailureKind.TIMEOUT, null);
        } else if (cause instanceof GenerationException generationError) {
            log.error("[Dispatch] Request {} failed: {} - {}", requestId, generationError.getKind(),
                    generationError.getMessage());
            reason = describeKind(generationError.getKind(), generationError.getStatusCode());
        } else {
            log.error("[Dispatch] Unexpected failure for request {}", requestId, cause);
            reason = describeKind(GenerationFailureKind.UNEXPECTED, null);
        }
        return messageService.getMessage("dispatch.failed", requestId, reason);
    }

    private String describeKind(GenerationFailureKind kind, Integer statusCode) {
        return switch (kind) {
        case UPSTREAM_ERROR -> messageService.getMessage("dispatch.failure.upstream",
                statusCode != null ? String.valueOf(statusCode) : "?");
        case NETWORK_ERROR -> messageService.getMessage("dispatch.failure.network");
        case MALFORMED_RESPONSE -> messageService.getMessage("dispatch.failure.malformed");
        case TIMEOUT -> messageService.getMessage("dispatch.failure.timeout");
        case UNEXPECTED -> messageService.getMessage("dispatch.failure.unexpected");
        };
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
