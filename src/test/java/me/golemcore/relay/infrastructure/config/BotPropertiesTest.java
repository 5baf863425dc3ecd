package me.golemcore.relay.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BotPropertiesTest {

    private BotProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("bot", BotProperties.class);
    }

    @Test
    void shouldUseDefaultsWhenNothingConfigured() {
        BotProperties properties = bind(Map.of());

        assertEquals(Duration.ofSeconds(60), properties.getAggregation().getQuietPeriod());
        assertEquals("Addendum:", properties.getAggregation().getMergeMarker());
        assertEquals(Duration.ofSeconds(30), properties.getGeneration().getTimeout());
        assertEquals("gemini-pro", properties.getGeneration().getModel());
        assertTrue(properties.getGeneration().getApiKeys().isEmpty());
        assertEquals("en", properties.getLanguage());
    }

    @Test
    void shouldSplitCommaSeparatedKeys() {
        BotProperties properties = bind(Map.of("bot.generation.api-keys", "K1,K2,K3"));

        assertEquals(List.of("K1", "K2", "K3"), properties.getGeneration().getApiKeys());
    }

    @Test
    void shouldParseDurations() {
        BotProperties properties = bind(Map.of(
                "bot.aggregation.quiet-period", "5s",
                "bot.generation.timeout", "1500ms"));

        assertEquals(Duration.ofSeconds(5), properties.getAggregation().getQuietPeriod());
        assertEquals(Duration.ofMillis(1500), properties.getGeneration().getTimeout());
    }

    @Test
    void shouldBindTelegramChannel() {
        BotProperties properties = bind(Map.of(
                "bot.channels.telegram.enabled", "true",
                "bot.channels.telegram.token", "123:abc"));

        assertTrue(properties.getTelegram().isEnabled());
        assertEquals("123:abc", properties.getTelegram().getToken());
    }

    @Test
    void shouldCreateTelegramEntryOnDemand() {
        BotProperties properties = new BotProperties();

        assertFalse(properties.getTelegram().isEnabled());
        assertSame(properties.getTelegram(), properties.getChannels().get("telegram"));
    }
}
