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
import me.golemcore.relay.domain.model.UpsertResult;
import me.golemcore.relay.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owner → pending {@link AggregatedRequest}, at most one per owner.
 *
 * <p>
 * The map doubles as the owner → current request id index, so nothing ever
 * scans timers or ids to find an owner's request.
 *
 * <p>
 * Not thread-safe: every call must come from the {@link
 * me.golemcore.relay.domain.loop.EventLoop} thread. Timer lifecycle is not
 * handled here; callers retire and install timers from the returned ids.
 *
 * <p>
 * Ids are {@code <owner>_<epochSecond>} with a {@code _<n>} suffix when the
 * same owner gets more than one id in a second. The second never goes
 * backwards for an owner, so a clock step back cannot repeat an id. Owners
 * with nothing pending drop out of the id index once their second is past.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingRequestStore {

    private static final String PARAGRAPH_BREAK = "\n\n";

    private final BotProperties properties;

    private final Map<String, AggregatedRequest> requests = new HashMap<>();
    private final Map<String, IssuedId> lastIssuedIds = new HashMap<>();
    private long lastPrunedSecond = Long.MIN_VALUE;

    /**
     * Creates a request for the owner, or merges {@code text} into the pending
     * one under a freshly generated id.
     */
    public UpsertResult upsert(String owner, String text, Instant now) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(text, "text");

        AggregatedRequest existing = requests.get(owner);
        String requestId = nextRequestId(owner, now);

        if (existing == null) {
            requests.put(owner, AggregatedRequest.builder()
                    .owner(owner)
                    .id(requestId)
                    .text(text)
                    .createdAt(now)
                    .build());
            log.debug("Created request {} for owner {}", requestId, owner);
            return UpsertResult.created(requestId);
        }

        String merged = existing.getText() + PARAGRAPH_BREAK
                + properties.getAggregation().getMergeMarker() + "\n" + text;
        requests.put(owner, AggregatedRequest.builder()
                .owner(owner)
                .id(requestId)
                .text(merged)
                .createdAt(now)
                .build());
        log.info("Merged request {} into {}", existing.getId(), requestId);
        return UpsertResult.merged(requestId, existing.getId());
    }

    /**
     * Removes and returns the owner's request only if its id is still
     * {@code requestId}. Empty means the id was superseded or cancelled.
     */
    public Optional<AggregatedRequest> take(String owner, String requestId) {
        AggregatedRequest current = requests.get(owner);
        if (current == null || !current.getId().equals(requestId)) {
            return Optional.empty();
        }
        requests.remove(owner);
        return Optional.of(current);
    }

    /**
     * Read-only view of the owner's pending requests.
     */
    public List<AggregatedRequest> peekAll(String owner) {
        AggregatedRequest current = requests.get(owner);
        return current != null ? List.of(current) : List.of();
    }

    /**
     * Removes the owner's pending request, if any. The caller cancels the timer
     * of the returned request.
     */
    public Optional<AggregatedRequest> clear(String owner) {
        return Optional.ofNullable(requests.remove(owner));
    }

    public int size() {
        return requests.size();
    }

    int trackedIds() {
        return lastIssuedIds.size();
    }

    private String nextRequestId(String owner, Instant now) {
        long second = now.getEpochSecond();
        pruneIssuedIds(second);

        IssuedId previous = lastIssuedIds.get(owner);
        IssuedId issued = previous == null || second > previous.epochSecond()
                ? new IssuedId(second, 0)
                : new IssuedId(previous.epochSecond(), previous.sequence() + 1);
        lastIssuedIds.put(owner, issued);

        String base = owner + "_" + issued.epochSecond();
        return issued.sequence() == 0 ? base : base + "_" + issued.sequence();
    }

    private void pruneIssuedIds(long second) {
        if (second <= lastPrunedSecond) {
            return;
        }
        lastPrunedSecond = second;
        lastIssuedIds.entrySet().removeIf(entry -> entry.getValue().epochSecond() < second
                && !requests.containsKey(entry.getKey()));
    }

    private record IssuedId(long epochSecond, int sequence) {
    }
}
