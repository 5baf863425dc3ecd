package me.golemcore.relay.adapter.inbound.telegram;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.generics.TelegramClient;

/**
 * Spring configuration for the Telegram channel.
 *
 * <p>
 * Creates the long polling application and the Bot API client. The bot token
 * is mandatory: without {@code bot.channels.telegram.token} the context fails
 * to start.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class TelegramConfig {

    private final BotProperties properties;

    @Bean
    public TelegramBotsLongPollingApplication telegramBotsApplication() {
        return new TelegramBotsLongPollingApplication();
    }

    @Bean
    public TelegramClient telegramClient() {
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.error("Telegram bot token is not configured");
            throw new ConfigurationException("TELEGRAM_BOT_TOKEN is not set");
        }
        return new OkHttpTelegramClient(token);
    }
}
