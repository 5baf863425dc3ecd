package me.golemcore.relay.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * The merged text awaiting dispatch for one owner.
 *
 * <p>
 * Instances are immutable: a merge produces a new request with a new id and a
 * fresh {@code createdAt}, the previous instance is simply dropped.
 *
 * @since 1.0
 */
@Value
@Builder
public class AggregatedRequest {

    /** Opaque sender identity (Telegram user id). */
    String owner;

    /** Unique token derived from the owner and the creation instant. */
    String id;

    /** Accumulated prompt text, merges separated by the merge marker. */
    String text;

    /** Creation instant of the current id. */
    Instant createdAt;
}
