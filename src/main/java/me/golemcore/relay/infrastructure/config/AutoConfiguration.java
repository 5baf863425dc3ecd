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

import me.golemcore.relay.domain.service.KeyRotator;
import me.golemcore.relay.infrastructure.i18n.MessageService;
import me.golemcore.relay.port.inbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration that provides shared infrastructure beans and starts
 * the relay on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Exposes the {@link Clock} and {@link ObjectMapper} beans</li>
 * <li>Applies the configured user-facing language</li>
 * <li>Logs startup information (model, key pool size, quiet period)</li>
 * <li>Starts all enabled input channels</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;
    private final KeyRotator keyRotator;
    private final MessageService messageService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Relay starting...");
        messageService.setLanguage(properties.getLanguage());
        log.info("Generation model: {}", properties.getGeneration().getModel());
        log.info("Gemini API keys available: {}", keyRotator.size());
        log.info("Quiet period: {}, generation timeout: {}",
                properties.getAggregation().getQuietPeriod(), properties.getGeneration().getTimeout());

        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            BotProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
            if (channelProps != null && channelProps.isEnabled()) {
                log.info("Starting channel: {}", channelType);
                channel.start();
            }
        }

        log.info("GolemCore Relay started successfully");
    }
}
