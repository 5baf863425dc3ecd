package me.golemcore.relay.adapter.inbound.telegram;

import me.golemcore.relay.domain.model.InboundTextEvent;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelegramAdapterTest {

    private static final long USER_ID = 123L;
    private static final long CHAT_ID = 100L;

    private TelegramAdapter adapter;
    private TelegramClient telegramClient;
    private TelegramBotsLongPollingApplication botsApplication;
    private CommandPort commandRouter;
    private ApplicationEventPublisher eventPublisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        BotProperties properties = new BotProperties();
        properties.getTelegram().setEnabled(true);
        properties.getTelegram().setToken("test-token");

        eventPublisher = mock(ApplicationEventPublisher.class);
        telegramClient = mock(TelegramClient.class);
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(mock(Message.class));
        botsApplication = mock(TelegramBotsLongPollingApplication.class);
        commandRouter = mock(CommandPort.class);
        ObjectProvider<CommandPort> commandProvider = mock(ObjectProvider.class);
        when(commandProvider.getIfAvailable()).thenReturn(commandRouter);

        adapter = new TelegramAdapter(properties, eventPublisher, botsApplication, telegramClient,
                commandProvider);
    }

    // ===== Inbound text =====

    @Test
    void shouldPublishTextKeyedBySender() {
        adapter.consume(createTextUpdate(USER_ID, CHAT_ID, "Write an ad for a coffee shop"));

        ArgumentCaptor<InboundTextEvent> captor = ArgumentCaptor.forClass(InboundTextEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        InboundTextEvent event = captor.getValue();
        assertEquals("telegram", event.channelType());
        assertEquals("123", event.owner());
        assertEquals("Write an ad for a coffee shop", event.text());
        assertNotNull(event.receivedAt());
    }

    @Test
    void shouldPublishEmptyTextForNonTextMessage() {
        Update update = createTextUpdate(USER_ID, CHAT_ID, null);
        when(update.getMessage().hasText()).thenReturn(false);

        adapter.consume(update);

        ArgumentCaptor<InboundTextEvent> captor = ArgumentCaptor.forClass(InboundTextEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals("", captor.getValue().text());
    }

    @Test
    void shouldIgnoreUpdatesWithoutMessage() {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(false);

        adapter.consume(update);

        verifyNoInteractions(eventPublisher, commandRouter);
    }

    @Test
    void shouldIgnoreMessageWithoutSender() {
        Update update = createTextUpdate(USER_ID, CHAT_ID, "hello");
        when(update.getMessage().getFrom()).thenReturn(null);

        adapter.consume(update);

        verifyNoInteractions(eventPublisher);
    }

    // ===== Command routing =====

    @Test
    void shouldRouteKnownCommandAndReplyToChat() throws Exception {
        when(commandRouter.hasCommand("status")).thenReturn(true);
        when(commandRouter.execute(eq("status"), eq(List.of()), any()))
                .thenReturn(CompletableFuture.completedFuture(CommandPort.CommandResult.success("Nothing pending")));

        adapter.consume(createTextUpdate(USER_ID, CHAT_ID, "/status"));

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, timeout(2000)).execute(captor.capture());
        assertEquals("100", captor.getValue().getChatId());
        assertEquals("Nothing pending", captor.getValue().getText());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPassOwnerAndChatInCommandContext() {
        when(commandRouter.hasCommand("cancel")).thenReturn(true);
        when(commandRouter.execute(eq("cancel"), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(CommandPort.CommandResult.success("ok")));

        adapter.consume(createTextUpdate(USER_ID, CHAT_ID, "/cancel@relay_bot"));

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(commandRouter).execute(eq("cancel"), eq(List.of()), captor.capture());
        assertEquals("123", captor.getValue().get("owner"));
        assertEquals("100", captor.getValue().get("chatId"));
        assertEquals("telegram", captor.getValue().get("channelType"));
    }

    @Test
    void shouldSplitCommandArguments() {
        when(commandRouter.hasCommand("help")).thenReturn(true);
        when(commandRouter.execute(eq("help"), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(CommandPort.CommandResult.success("help")));

        adapter.consume(createTextUpdate(USER_ID, CHAT_ID, "/help  one two"));

        verify(commandRouter).execute(eq("help"), eq(List.of("one", "two")), any());
    }

    @Test
    void shouldTreatUnknownCommandAsText() {
        when(commandRouter.hasCommand("draft")).thenReturn(false);

        adapter.consume(createTextUpdate(USER_ID, CHAT_ID, "/draft a tagline"));

        verify(commandRouter, never()).execute(any(), any(), any());
        ArgumentCaptor<InboundTextEvent> captor = ArgumentCaptor.forClass(InboundTextEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals("/draft a tagline", captor.getValue().text());
    }

    @Test
    void shouldReplyWhenCommandFails() throws Exception {
        when(commandRouter.hasCommand("status")).thenReturn(true);
        when(commandRouter.execute(eq("status"), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("loop stopped")));

        adapter.consume(createTextUpdate(USER_ID, CHAT_ID, "/status"));

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, timeout(2000)).execute(captor.capture());
        assertTrue(captor.getValue().getText().startsWith("Command failed"));
    }

    // ===== Outbound =====

    @Test
    void shouldSendPlainTextMessage() throws Exception {
        adapter.sendMessage("123", "Answer to request 123_1\n\n*not markdown*").get();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals("123", captor.getValue().getChatId());
        assertNull(captor.getValue().getParseMode());
    }

    @Test
    void shouldSplitLongMessageIntoChunks() throws Exception {
        String paragraph = "x".repeat(3000);
        adapter.sendMessage("123", paragraph + "\n\n" + paragraph).get();

        verify(telegramClient, times(2)).execute(any(SendMessage.class));
    }

    @Test
    void shouldFailFutureWhenTelegramRejects() throws Exception {
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(new org.telegram.telegrambots.meta.exceptions.TelegramApiException("Forbidden"));

        CompletableFuture<Void> result = adapter.sendMessage("123", "hello");

        assertThrows(Exception.class, result::join);
    }

    @Test
    void shouldDeliverMessagesToOneChatInCallOrder() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        List<String> delivered = new CopyOnWriteArrayList<>();
        Message sent = mock(Message.class);
        when(telegramClient.execute(any(SendMessage.class))).thenAnswer(invocation -> {
            SendMessage message = invocation.getArgument(0);
            if ("123".equals(message.getChatId()) && "first".equals(message.getText())) {
                firstStarted.countDown();
                releaseFirst.await(5, TimeUnit.SECONDS);
            }
            delivered.add(message.getChatId() + ":" + message.getText());
            return sent;
        });

        CompletableFuture<Void> first = adapter.sendMessage("123", "first");
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        CompletableFuture<Void> second = adapter.sendMessage("123", "second");

        adapter.sendMessage("456", "other chat").get(5, TimeUnit.SECONDS);
        assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
        assertEquals(List.of("456:other chat"), delivered);

        releaseFirst.countDown();
        CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("456:other chat", "123:first", "123:second"), delivered);
    }

    @Test
    void shouldKeepSendingToChatAfterFailedSend() throws Exception {
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(new org.telegram.telegrambots.meta.exceptions.TelegramApiException("Too Many Requests"))
                .thenReturn(mock(Message.class));

        CompletableFuture<Void> failed = adapter.sendMessage("123", "first");
        CompletableFuture<Void> next = adapter.sendMessage("123", "second");

        next.get(5, TimeUnit.SECONDS);
        assertTrue(failed.isCompletedExceptionally());
        verify(telegramClient, times(2)).execute(any(SendMessage.class));
    }

    @Test
    void shouldForgetChatOnceItsSendsComplete() throws Exception {
        adapter.sendMessage("123", "hello").get(5, TimeUnit.SECONDS);

        // the chain entry is dropped by a completion callback that may trail get()
        long deadline = System.currentTimeMillis() + 2000;
        while (adapter.pendingSendChains() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, adapter.pendingSendChains());
    }

    @Test
    void shouldSplitAtParagraphBoundary() {
        String first = "a".repeat(50);
        String second = "b".repeat(50);

        List<String> chunks = TelegramAdapter.splitAtNewlines(first + "\n\n" + second, 80);

        assertEquals(List.of(first, second), chunks);
    }

    @Test
    void shouldHardSplitWithoutNewlines() {
        List<String> chunks = TelegramAdapter.splitAtNewlines("c".repeat(25), 10);

        assertEquals(3, chunks.size());
        assertEquals(5, chunks.get(2).length());
    }

    // ===== Lifecycle =====

    @Test
    void shouldRegisterBotOnStart() throws Exception {
        adapter.start();

        verify(botsApplication).registerBot("test-token", adapter);
        assertTrue(adapter.isRunning());
        assertEquals("telegram", adapter.getChannelType());
    }

    @Test
    void shouldStopRunning() throws Exception {
        adapter.start();
        adapter.stop();

        assertFalse(adapter.isRunning());
        verify(botsApplication).close();
    }

    private Update createTextUpdate(long userId, long chatId, String text) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(userId);

        Message telegramMsg = mock(Message.class);
        when(telegramMsg.getChatId()).thenReturn(chatId);
        when(telegramMsg.getFrom()).thenReturn(user);
        when(telegramMsg.hasText()).thenReturn(text != null);
        when(telegramMsg.getText()).thenReturn(text);

        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(telegramMsg);
        return update;
    }
}
