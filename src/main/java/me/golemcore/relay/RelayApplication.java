package me.golemcore.relay;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Relay.
 *
 * <p>
 * GolemCore Relay is a Telegram bot that collects a user's free-text messages,
 * waits for a quiet period so that follow-up clarifications land in the same
 * request, and sends the aggregated request to the Gemini text-generation API
 * using a rotating pool of API keys.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Debounced aggregation</b> - messages that arrive within the quiet
 * period are merged into one request</li>
 * <li><b>Key rotation</b> - strict round-robin over the configured Gemini API
 * keys</li>
 * <li><b>Request tracking</b> - every request gets an id that is echoed in the
 * answer, {@code /status} and {@code /cancel} work per user</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters) around a single-threaded event
 * loop:
 *
 * <pre>
 * Input Layer        → TelegramAdapter, CommandRouter
 * Domain Layer       → EventLoop, AggregationService, DebounceScheduler, DispatchService
 * Infrastructure     → Gemini adapter (Feign + OkHttp), i18n, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix, with environment overrides for secrets.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayApplication.class, args);
    }

}
