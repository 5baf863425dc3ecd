package me.golemcore.relay.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link ChannelProperties} - input channels (Telegram)</li>
 * <li>{@link GenerationProperties} - Gemini endpoint, model, key pool and call
 * timeout</li>
 * <li>{@link AggregationProperties} - quiet period, merge marker and
 * instruction prefix</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * </ul>
 *
 * <p>
 * Secrets come from the environment ({@code TELEGRAM_BOT_TOKEN},
 * {@code GEMINI_API_KEYS}); see {@code application.properties} for the
 * mapping.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "en";
    private Map<String, ChannelProperties> channels = new HashMap<>();
    private GenerationProperties generation = new GenerationProperties();
    private AggregationProperties aggregation = new AggregationProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
    }

    @Data
    public static class GenerationProperties {
        private String apiUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String model = "gemini-pro";
        private List<String> apiKeys = new ArrayList<>();
        /** Upper bound for a single generation call, including the HTTP exchange. */
        private Duration timeout = Duration.ofSeconds(30);
        private double temperature = 0.7;
        private int topK = 40;
        private double topP = 0.95;
        private int maxOutputTokens = 1024;
    }

    @Data
    public static class AggregationProperties {
        /** Delay after the last message before the aggregated request is sent. */
        private Duration quietPeriod = Duration.ofSeconds(60);
        private String mergeMarker = "Addendum:";
        /** Optional text prepended to every request before dispatch. */
        private String instructionPrefix = "";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    /**
     * Returns the Telegram channel settings, creating an empty entry when the
     * channel is not configured at all.
     */
    public ChannelProperties getTelegram() {
        return channels.computeIfAbsent("telegram", key -> new ChannelProperties());
    }
}
