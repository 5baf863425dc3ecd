package me.golemcore.relay.domain.loop;

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

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Single logical thread on which every mutation of relay state happens:
 * inbound texts, timer fires, status and cancel commands.
 *
 * <p>
 * Events run one at a time to completion. Ordering is by trigger instant, ties
 * by submission sequence: an event submitted now triggers now, a scheduled
 * event triggers when its delay elapses. Consequently a timer whose trigger
 * instant is not later than the arrival of a message runs before that message.
 *
 * <p>
 * Work that suspends (the generation call) must leave the loop and must not
 * touch relay state when it completes.
 *
 * @since 1.0
 */
public interface EventLoop {

    /**
     * Runs {@code event} on the loop. The future completes with its result, or
     * exceptionally if it throws.
     */
    <T> CompletableFuture<T> submit(Callable<T> event);

    /**
     * Runs {@code event} on the loop.
     */
    default CompletableFuture<Void> execute(Runnable event) {
        return submit(() -> {
            event.run();
            return null;
        });
    }

    /**
     * Runs {@code event} on the loop once {@code delay} has elapsed, unless the
     * returned task is cancelled first.
     */
    ScheduledTask schedule(Runnable event, Duration delay);

    /**
     * Handle of a delayed event.
     */
    interface ScheduledTask {

        /**
         * Prevents the event from running if it has not started yet. Returns
         * {@code false} when it already ran or was cancelled.
         */
        boolean cancel();
    }
}
