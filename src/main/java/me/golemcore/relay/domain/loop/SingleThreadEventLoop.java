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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single-threaded
 * {@link ScheduledExecutorService}.
 *
 * <p>
 * The executor's delay queue orders tasks by trigger time and then by
 * submission sequence, which is exactly the ordering contract of
 * {@link EventLoop}. Failures inside an event are logged and never kill the
 * loop thread.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SingleThreadEventLoop implements EventLoop {

    private static final String THREAD_NAME = "relay-event-loop";

    private final ScheduledExecutorService executor = createExecutor();

    private static ScheduledExecutorService createExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        // merges cancel a timer per message, keep the queue free of dead entries
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> event) {
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(event.call());
            } catch (Exception e) { // NOSONAR - must not kill loop thread
                log.error("[EventLoop] Event failed", e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    @Override
    public ScheduledTask schedule(Runnable event, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                event.run();
            } catch (RuntimeException e) { // NOSONAR - must not kill loop thread
                log.error("[EventLoop] Scheduled event failed", e);
            }
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[EventLoop] Shut down");
    }
}
