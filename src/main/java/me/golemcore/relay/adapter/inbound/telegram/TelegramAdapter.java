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

import me.golemcore.relay.domain.model.InboundTextEvent;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.inbound.ChannelPort;
import me.golemcore.relay.port.inbound.CommandPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements both {@link ChannelPort} for outbound messaging and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Long polling for incoming messages via Telegram Bot API
 * <li>Command routing (slash commands) before aggregation
 * <li>Plain text published as {@link InboundTextEvent}, keyed by the sender's
 * user id
 * <li>Message splitting for Telegram's 4096 character limit
 * </ul>
 *
 * <p>
 * Text is sent without a parse mode: generated answers are delivered as they
 * come back from the generation service. Sends to one chat run one after
 * another in call order; different chats are sent to concurrently.
 *
 * @see me.golemcore.relay.port.inbound.ChannelPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final int SPLIT_CHUNK_LENGTH = 3800;

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramClient telegramClient;
    private final ObjectProvider<CommandPort> commandRouter;

    private final Map<String, CompletableFuture<Void>> sendTails = new ConcurrentHashMap<>();

    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }

            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage()) {
            handleMessage(update);
        }
    }

    private void handleMessage(Update update) {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = update.getMessage();
        if (telegramMessage.getFrom() == null) {
            log.debug("Ignoring message without sender in chat {}", telegramMessage.getChatId());
            return;
        }
        String chatId = telegramMessage.getChatId().toString();
        String owner = telegramMessage.getFrom().getId().toString();
        String text = telegramMessage.hasText() ? telegramMessage.getText() : "";

        if (text.startsWith("/") && routeCommand(text, owner, chatId)) {
            return;
        }

        eventPublisher.publishEvent(new InboundTextEvent(CHANNEL_TYPE, owner, text, Instant.now()));
    }

    private boolean routeCommand(String text, String owner, String chatId) {
        String[] parts = text.trim().split("\\s+", 2);
        String cmd = parts[0].substring(1).split("@")[0]; // strip / and @botname

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null || !router.hasCommand(cmd)) {
            return false;
        }

        List<String> args = parts.length > 1
                ? Arrays.asList(parts[1].split("\\s+"))
                : List.of();
        Map<String, Object> ctx = Map.<String, Object>of(
                "owner", owner,
                "chatId", chatId,
                "channelType", CHANNEL_TYPE);
        try {
            var result = router.execute(cmd, args, ctx).join();
            sendMessage(chatId, result.output());
        } catch (Exception e) {
            log.error("Command execution failed: /{}", cmd, e);
            sendMessage(chatId, "Command failed: " + e.getMessage());
        }
        return true;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        // a failed send does not hold back the next one for the chat
        CompletableFuture<Void> send = sendTails.compute(chatId, (id, tail) -> {
            CompletableFuture<?> previous = tail != null
                    ? tail.handle((ignored, error) -> null)
                    : CompletableFuture.completedFuture(null);
            return previous.thenRunAsync(() -> deliver(chatId, content));
        });
        send.whenComplete((ignored, error) -> sendTails.remove(chatId, send));
        return send;
    }

    private void deliver(String chatId, String content) {
        try {
            for (String chunk : splitAtNewlines(content, SPLIT_CHUNK_LENGTH)) {
                SendMessage sendMessage = SendMessage.builder()
                        .chatId(chatId)
                        .text(chunk)
                        .build();
                telegramClient.execute(sendMessage);
            }
        } catch (Exception e) {
            log.error("Failed to send message to chat: {}", chatId, e);
            throw new IllegalStateException("Failed to send message", e);
        }
    }

    int pendingSendChains() {
        return sendTails.size();
    }

    /**
     * Telegram rejects messages over 4096 characters. Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            // Try paragraph break
            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            // Try line break
            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            // Hard split as last resort
            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }
}
