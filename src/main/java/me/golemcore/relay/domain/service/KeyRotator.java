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

import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.config.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Strict round-robin rotation over the configured Gemini API keys.
 *
 * <p>
 * The pool is fixed at startup and must not be empty; an empty pool fails
 * construction with {@link ConfigurationException}, which keeps
 * {@link #next()} total. Rotation is global: every call advances the cursor by
 * one, whichever owner triggered the dispatch.
 *
 * <p>
 * Dispatches call {@link #next()} from the event loop only, but the method is
 * synchronized so the cursor stays consistent if that ever changes.
 *
 * <p>
 * Failing keys stay in rotation; there is no health tracking.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class KeyRotator {

    private final List<String> pool;
    private int cursor;

    @Autowired
    public KeyRotator(BotProperties properties) {
        this(properties.getGeneration().getApiKeys());
    }

    public KeyRotator(List<String> credentials) {
        List<String> keys = credentials == null ? List.of()
                : credentials.stream()
                        .filter(key -> key != null && !key.isBlank())
                        .map(String::trim)
                        .toList();
        if (keys.isEmpty()) {
            throw new ConfigurationException(
                    "No Gemini API keys configured, set GEMINI_API_KEYS (comma separated)");
        }
        this.pool = keys;
        log.info("[Rotator] Initialized with {} API key(s)", keys.size());
    }

    /**
     * Returns the key under the cursor and advances the cursor.
     */
    public synchronized String next() {
        int index = cursor;
        cursor = (cursor + 1) % pool.size();
        log.debug("[Rotator] Using API key #{} of {}", index + 1, pool.size());
        return pool.get(index);
    }

    public int size() {
        return pool.size();
    }

    /**
     * Index of the key the next call will return.
     */
    public synchronized int getCursor() {
        return cursor;
    }
}
