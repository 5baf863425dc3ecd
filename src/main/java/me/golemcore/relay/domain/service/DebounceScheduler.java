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
import me.golemcore.relay.domain.model.TimerState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Owns one cancellable quiet-period timer per pending request id.
 *
 * <p>
 * Each timer moves {@code SCHEDULED → FIRED} or {@code SCHEDULED → CANCELLED}
 * and never leaves a terminal state:
 * <ul>
 * <li>{@link #schedule} installs a timer; when the delay elapses the fire
 * callback runs exactly once and the timer removes itself</li>
 * <li>{@link #cancel} retires a scheduled timer; unknown, fired or already
 * cancelled ids are a no-op</li>
 * </ul>
 *
 * <p>
 * All methods run on the {@link EventLoop} thread, and so do fires. A fire is
 * therefore never interleaved with a merge: it happens strictly before or
 * after it. A merge that reaches the loop first cancels the timer, and the fire
 * event, if it was already queued, observes {@link TimerState#CANCELLED} and
 * does nothing.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DebounceScheduler {

    private final EventLoop eventLoop;

    private final Map<String, DebounceTimer> timers = new HashMap<>();

    /**
     * Starts the quiet-period timer for {@code requestId}. A timer already
     * installed under the same id is cancelled first.
     */
    public void schedule(String requestId, Duration delay, Consumer<String> onFire) {
        if (timers.containsKey(requestId)) {
            log.warn("[Debounce] Timer for {} already scheduled, replacing", requestId);
            cancel(requestId);
        }

        DebounceTimer timer = new DebounceTimer(requestId, onFire);
        timers.put(requestId, timer);
        timer.task = eventLoop.schedule(() -> fire(timer), delay);
        log.debug("[Debounce] Scheduled {} in {}", requestId, delay);
    }

    /**
     * Retires the timer of {@code requestId}. Returns {@code true} if a
     * scheduled timer was cancelled.
     */
    public boolean cancel(String requestId) {
        DebounceTimer timer = timers.remove(requestId);
        if (timer == null) {
            return false;
        }
        timer.state = TimerState.CANCELLED;
        timer.task.cancel();
        log.debug("[Debounce] Cancelled {}", requestId);
        return true;
    }

    /**
     * State of a live timer. Fired and cancelled timers are discarded, so they
     * report empty.
     */
    public Optional<TimerState> getState(String requestId) {
        DebounceTimer timer = timers.get(requestId);
        return timer != null ? Optional.of(timer.state) : Optional.empty();
    }

    public int activeTimers() {
        return timers.size();
    }

    private void fire(DebounceTimer timer) {
        if (timer.state != TimerState.SCHEDULED) {
            log.debug("[Debounce] Skipping fire of {} ({})", timer.requestId, timer.state);
            return;
        }
        timer.state = TimerState.FIRED;
        timers.remove(timer.requestId, timer);
        log.info("[Debounce] Quiet period elapsed for {}", timer.requestId);
        timer.onFire.accept(timer.requestId);
    }

    private static final class DebounceTimer {
        private final String requestId;
        private final Consumer<String> onFire;
        private TimerState state = TimerState.SCHEDULED;
        private EventLoop.ScheduledTask task;

        private DebounceTimer(String requestId, Consumer<String> onFire) {
            this.requestId = requestId;
            this.onFire = onFire;
        }
    }
}
