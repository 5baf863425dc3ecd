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

import me.golemcore.relay.port.inbound.ChannelPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Best-effort delivery of relay notices to an owner through the channel.
 *
 * <p>
 * Delivery failures, synchronous or asynchronous, are logged and swallowed:
 * a lost notice must never abort dispatch or aggregation bookkeeping.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OwnerNotifier {

    private final ChannelPort channelPort;

    public CompletableFuture<Void> notify(String owner, String text) {
        try {
            CompletableFuture<Void> delivery = channelPort.sendMessage(owner, text);
            if (delivery == null) {
                return CompletableFuture.completedFuture(null);
            }
            return delivery.exceptionally(e -> {
                log.warn("Failed to notify {}: {}", owner, e.getMessage());
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("Failed to notify {}: {}", owner, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }
}
