package me.golemcore.relay.adapter.inbound.command;

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

import me.golemcore.relay.domain.model.AggregatedRequest;
import me.golemcore.relay.domain.service.AggregationService;
import me.golemcore.relay.infrastructure.i18n.MessageService;
import me.golemcore.relay.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Slash-command router for the relay.
 *
 * <p>
 * {@code /start} and {@code /help} answer with static localized texts.
 * {@code /status} and {@code /cancel} are forwarded to
 * {@link AggregationService} for the owner found in the context under
 * {@code "owner"}.
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    static final int PREVIEW_LENGTH = 50;
    private static final String CMD_START = "start";
    private static final String CMD_HELP = "help";
    private static final String CMD_STATUS = "status";
    private static final String CMD_CANCEL = "cancel";
    private static final String CONTEXT_OWNER = "owner";

    private static final List<String> KNOWN_COMMANDS = List.of(CMD_START, CMD_HELP, CMD_STATUS, CMD_CANCEL);
    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private final AggregationService aggregationService;
    private final MessageService messageService;
    private final DateTimeFormatter timeFormatter;

    public CommandRouter(AggregationService aggregationService, MessageService messageService, Clock clock) {
        this.aggregationService = aggregationService;
        this.messageService = messageService;
        this.timeFormatter = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(clock.getZone());
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        log.debug("Executing command: /{}", command);
        if (!hasCommand(command)) {
            return CompletableFuture.completedFuture(CommandResult.failure(msg("command.unknown", command)));
        }

        return switch (command) {
        case CMD_START -> CompletableFuture.completedFuture(CommandResult.success(msg("command.start")));
        case CMD_HELP -> CompletableFuture.completedFuture(handleHelp());
        case CMD_STATUS -> withOwner(context, this::handleStatus);
        case CMD_CANCEL -> withOwner(context, this::handleCancel);
        default -> CompletableFuture.completedFuture(CommandResult.failure(msg("command.unknown", command)));
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_START, msg("command.start.description"), "/start"),
                new CommandDefinition(CMD_HELP, msg("command.help.description"), "/help"),
                new CommandDefinition(CMD_STATUS, msg("command.status.description"), "/status"),
                new CommandDefinition(CMD_CANCEL, msg("command.cancel.description"), "/cancel"));
    }

    private CompletableFuture<CommandResult> withOwner(Map<String, Object> context,
            Function<String, CompletableFuture<CommandResult>> handler) {
        Object owner = context.get(CONTEXT_OWNER);
        if (!(owner instanceof String) || ((String) owner).isBlank()) {
            return CompletableFuture.completedFuture(CommandResult.failure(msg("command.owner.missing")));
        }
        return handler.apply((String) owner);
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.help.header")).append("\n\n");
        for (CommandDefinition command : listCommands()) {
            sb.append(command.usage()).append(" - ").append(command.description()).append("\n");
        }
        return CommandResult.success(sb.toString().trim());
    }

    private CompletableFuture<CommandResult> handleStatus(String owner) {
        return aggregationService.onStatusQuery(owner).thenApply(pending -> {
            if (pending.isEmpty()) {
                return CommandResult.success(msg("command.status.empty"), pending);
            }
            StringBuilder sb = new StringBuilder(msg("command.status.header"));
            for (AggregatedRequest request : pending) {
                sb.append("\n\n").append(msg("command.status.entry",
                        request.getId(),
                        preview(request.getText()),
                        timeFormatter.format(request.getCreatedAt()),
                        msg("command.status.awaiting")));
            }
            return CommandResult.success(sb.toString(), pending);
        });
    }

    private CompletableFuture<CommandResult> handleCancel(String owner) {
        return aggregationService.onCancel(owner).thenApply(count -> count == 0
                ? CommandResult.success(msg("command.cancel.none"), count)
                : CommandResult.success(msg("command.cancel.done", count), count));
    }

    static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
