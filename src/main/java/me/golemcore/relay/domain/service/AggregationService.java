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

import me.golemcore.relay.domain.loop.EventLoop;
import me.golemcore.relay.domain.model.AggregatedRequest;
import me.golemcore.relay.domain.model.InboundTextEvent;
import me.golemcore.relay.domain.model.UpsertResult;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.i18n.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Inbound side of the relay: turns texts, status queries and cancel requests
 * into store and timer operations on the {@link EventLoop}.
 *
 * <p>
 * A text either creates the owner's request or merges into it. On merge the
 * superseded id's timer is cancelled and the new id's timer installed within
 * the same loop event, so two live timers for one owner never coexist.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationService {

    private final EventLoop eventLoop;
    private final PendingRequestStore store;
    private final DebounceScheduler debounceScheduler;
    private final DispatchService dispatchService;
    private final OwnerNotifier notifier;
    private final MessageService messageService;
    private final BotProperties properties;
    private final Clock clock;

    @EventListener
    public void onInboundText(InboundTextEvent event) {
        String owner = event.owner();
        if (event.text() == null || event.text().isBlank()) {
            notifier.notify(owner, messageService.getMessage("request.empty"));
            return;
        }

        onText(owner, event.text()).whenComplete((result, error) -> {
            if (error != null) {
                log.error("Failed to register text from {}", owner, error);
                notifier.notify(owner, messageService.getMessage("request.failed"));
                return;
            }
            Duration quietPeriod = properties.getAggregation().getQuietPeriod();
            String acknowledgement = result.merge()
                    ? messageService.getMessage("request.merged", result.requestId(),
                            result.previousRequestId(), quietPeriod.toSeconds())
                    : messageService.getMessage("request.received", result.requestId(), quietPeriod.toSeconds());
            notifier.notify(owner, acknowledgement);
        });
    }

    /**
     * Stores {@code text} for {@code owner} and (re)starts the quiet-period
     * timer of the resulting request.
     */
    public CompletableFuture<UpsertResult> onText(String owner, String text) {
        return eventLoop.submit(() -> {
            UpsertResult result = store.upsert(owner, text, clock.instant());
            if (result.merge()) {
                debounceScheduler.cancel(result.previousRequestId());
            }
            debounceScheduler.schedule(result.requestId(), properties.getAggregation().getQuietPeriod(),
                    requestId -> dispatchService.dispatch(owner, requestId));
            log.info("{} request {} for owner {}", result.merge() ? "Merged into" : "Created",
                    result.requestId(), owner);
            return result;
        });
    }

    /**
     * Snapshot of the owner's pending requests.
     */
    public CompletableFuture<List<AggregatedRequest>> onStatusQuery(String owner) {
        return eventLoop.submit(() -> store.peekAll(owner));
    }

    /**
     * Cancels every pending request of {@code owner} and returns how many were
     * cancelled. Zero when nothing is pending.
     */
    public CompletableFuture<Integer> onCancel(String owner) {
        return eventLoop.submit(() -> cancelAll(owner));
    }

    private int cancelAll(String owner) {
        int cancelled = 0;
        for (AggregatedRequest request : store.clear(owner).stream().toList()) {
            debounceScheduler.cancel(request.getId());
            cancelled++;
        }
        if (cancelled > 0) {
            log.info("Cancelled {} request(s) for owner {}", cancelled, owner);
        }
        return cancelled;
    }
}
