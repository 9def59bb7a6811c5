package io.github.goodees.cqrs.commanding;

/*-
 * #%L
 * cqrs-core
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.cqrs.domain.AggregateRoot;
import io.github.goodees.cqrs.domain.AggregateStorage;
import io.github.goodees.cqrs.domain.DomainEvent;
import io.github.goodees.cqrs.domain.MemoryCache;
import io.github.goodees.cqrs.eventing.DomainEventStream;
import io.github.goodees.cqrs.eventing.EventCommittingContext;
import io.github.goodees.cqrs.eventing.EventService;
import io.github.goodees.cqrs.eventing.EventStore;
import io.github.goodees.cqrs.infrastructure.ApplicationMessage;
import io.github.goodees.cqrs.infrastructure.JsonSerializer;
import io.github.goodees.cqrs.infrastructure.Markers;
import io.github.goodees.cqrs.infrastructure.MessagePublisher;
import io.github.goodees.cqrs.infrastructure.PublishableException;
import io.github.goodees.cqrs.infrastructure.RetryExecutor;
import io.github.goodees.cqrs.infrastructure.TypeNameProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;

/**
 * Turns a dispatched command into at most one event stream.
 * <p>Synchronous handlers run against the command's own aggregate from {@link MemoryCache}, other aggregates are
 * private copies loaded from {@link AggregateStorage}. After the handler returns, exactly one aggregate may have
 * changes. Its changes become a {@link DomainEventStream} with the next version, which is passed to
 * {@link EventService} and the mailbox continues with the next command. Zero changed aggregates complete the command
 * as {@link CommandStatus#NOTHING_CHANGED}, more than one fail it.</p>
 * <p>When a handler throws, the command may have been applied already, and fail now only because it was delivered
 * again. Therefore the event store is asked for a stream of the command first, and if one exists it is published
 * again instead of failing the command.</p>
 * <p>Asynchronous handlers are recorded in {@link CommandStore} along with the application message they produced,
 * which is then published.</p>
 */
public class DefaultProcessingCommandHandler implements ProcessingCommandHandler {
    private static final Logger logger = LoggerFactory.getLogger(DefaultProcessingCommandHandler.class);

    private final RetryExecutor retryExecutor;
    private final MemoryCache memoryCache;
    private final AggregateStorage storage;
    private final EventService eventService;
    private final EventStore eventStore;
    private final CommandStore commandStore;
    private final CommandHandlerProvider handlerProvider;
    private final CommandAsyncHandlerProvider asyncHandlerProvider;
    private final TypeNameProvider typeNameProvider;
    private final MessagePublisher<ApplicationMessage> applicationMessagePublisher;
    private final MessagePublisher<PublishableException> exceptionPublisher;
    private final JsonSerializer jsonSerializer;

    public DefaultProcessingCommandHandler(RetryExecutor retryExecutor, MemoryCache memoryCache,
            AggregateStorage storage, EventService eventService, EventStore eventStore, CommandStore commandStore,
            CommandHandlerProvider handlerProvider, CommandAsyncHandlerProvider asyncHandlerProvider,
            TypeNameProvider typeNameProvider, MessagePublisher<ApplicationMessage> applicationMessagePublisher,
            MessagePublisher<PublishableException> exceptionPublisher, JsonSerializer jsonSerializer) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "Retry executor must be specified");
        this.memoryCache = Objects.requireNonNull(memoryCache, "Memory cache must be specified");
        this.storage = Objects.requireNonNull(storage, "Aggregate storage must be specified");
        this.eventService = Objects.requireNonNull(eventService, "Event service must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.commandStore = Objects.requireNonNull(commandStore, "Command store must be specified");
        this.handlerProvider = Objects.requireNonNull(handlerProvider, "Handler provider must be specified");
        this.asyncHandlerProvider = Objects.requireNonNull(asyncHandlerProvider,
                "Async handler provider must be specified");
        this.typeNameProvider = Objects.requireNonNull(typeNameProvider, "Type name provider must be specified");
        this.applicationMessagePublisher = Objects.requireNonNull(applicationMessagePublisher,
                "Application message publisher must be specified");
        this.exceptionPublisher = Objects.requireNonNull(exceptionPublisher, "Exception publisher must be specified");
        this.jsonSerializer = Objects.requireNonNull(jsonSerializer, "Serializer must be specified");
    }

    @Override
    public void handle(ProcessingCommand processingCommand) {
        CommandExecuteContext context = new CommandExecuteContext(processingCommand, memoryCache, storage);
        Command command = processingCommand.getCommand();

        if (command.getAggregateRootId() == null || command.getAggregateRootId().isEmpty()) {
            String errorMessage = String.format("The aggregateRootId of command cannot be null or empty. "
                    + "commandType: %s, commandId: %s", command.getClass().getSimpleName(), command.getId());
            logger.error(errorMessage);
            completeCommand(context, CommandStatus.FAILED, String.class.getName(), errorMessage);
            return;
        }

        HandlerLookup<CommandHandler<Command>> lookup =
                findHandler(handlerProvider.getHandlers(command.getClass()));
        switch (lookup.outcome) {
            case FOUND:
                handleCommand(context, lookup.handler, lookup.name);
                return;
            case TOO_MANY_REGISTRATIONS:
                logger.error("Found more than one command handler registration, commandType: {}, commandId: {}",
                        command.getClass().getName(), command.getId());
                completeCommand(context, CommandStatus.FAILED, String.class.getName(),
                        "More than one command handler registration found.");
                return;
            case TOO_MANY_HANDLERS:
                logger.error("Found more than one command handler, commandType: {}, commandId: {}",
                        command.getClass().getName(), command.getId());
                completeCommand(context, CommandStatus.FAILED, String.class.getName(),
                        "More than one command handler found.");
                return;
            default:
                break;
        }

        HandlerLookup<CommandAsyncHandler<Command>> asyncLookup =
                findHandler(asyncHandlerProvider.getAsyncHandlers(command.getClass()));
        switch (asyncLookup.outcome) {
            case FOUND:
                handleAsyncCommand(context, asyncLookup.handler, asyncLookup.name);
                break;
            case TOO_MANY_REGISTRATIONS:
                logger.error("Found more than one command async handler registration, commandType: {}, commandId: {}",
                        command.getClass().getName(), command.getId());
                completeCommand(context, CommandStatus.FAILED, String.class.getName(),
                        "More than one command async handler registration found.");
                break;
            case TOO_MANY_HANDLERS:
                logger.error("Found more than one command async handler, commandType: {}, commandId: {}",
                        command.getClass().getName(), command.getId());
                completeCommand(context, CommandStatus.FAILED, String.class.getName(),
                        "More than one command async handler found.");
                break;
            default:
                String errorMessage = String.format("No command handler found of command. commandType: %s, "
                        + "commandId: %s", command.getClass().getSimpleName(), command.getId());
                logger.error(errorMessage);
                completeCommand(context, CommandStatus.FAILED, String.class.getName(), errorMessage);
                break;
        }
    }

    // synchronous handlers

    private void handleCommand(CommandExecuteContext context, CommandHandler<Command> handler, String handlerType) {
        Command command = context.getProcessingCommand().getCommand();
        try {
            handler.handle(context, command);
            logger.debug("Handle command success. handlerType: {}, commandType: {}, commandId: {}, "
                    + "aggregateRootId: {}", handlerType, command.getClass().getSimpleName(),
                    command.getId(), command.getAggregateRootId());
        } catch (Exception e) {
            discardChanges(context);
            handleException(context, handlerType, e);
            return;
        }
        try {
            commitAggregateChanges(context);
        } catch (RuntimeException e) {
            discardChanges(context);
            logCommandExecuteException(context, handlerType, e);
            completeCommand(context, CommandStatus.FAILED, e.getClass().getSimpleName(),
                    "Unknown exception caught when committing changes of command.");
        }
    }

    private void commitAggregateChanges(CommandExecuteContext context) {
        Command command = context.getProcessingCommand().getCommand();
        List<AggregateRoot> dirty = context.getTrackedAggregates().stream()
                .filter(AggregateRoot::hasChanges)
                .collect(Collectors.toList());

        if (dirty.size() > 1) {
            String errorMessage = String.format("Detected more than one aggregate created or modified by command. "
                    + "commandType: %s, commandId: %s", command.getClass().getSimpleName(), command.getId());
            logger.error(errorMessage);
            discardChanges(context);
            completeCommand(context, CommandStatus.FAILED, String.class.getName(), errorMessage);
            return;
        }
        if (dirty.isEmpty()) {
            completeCommand(context, CommandStatus.NOTHING_CHANGED, String.class.getName(), context.getResult());
            return;
        }

        AggregateRoot aggregateRoot = dirty.get(0);
        DomainEventStream eventStream = buildDomainEventStream(aggregateRoot, aggregateRoot.getChanges(), context);
        eventService.commitDomainEvent(new EventCommittingContext(aggregateRoot, eventStream, context));
    }

    private DomainEventStream buildDomainEventStream(AggregateRoot aggregateRoot, List<DomainEvent> changes,
            CommandExecuteContext context) {
        ProcessingCommand processingCommand = context.getProcessingCommand();
        Map<String, String> items = new HashMap<>(processingCommand.getItems());
        if (context.getResult() != null) {
            items.put(DomainEventStream.COMMAND_RESULT_ITEM, context.getResult());
        }
        return new DomainEventStream(processingCommand.getCommand().getId(), aggregateRoot.getId(),
                typeNameProvider.getTypeName(aggregateRoot.getClass()), aggregateRoot.getVersion() + 1,
                Instant.now(), changes, items);
    }

    private void handleException(CommandExecuteContext context, String handlerType, Exception exception) {
        Command command = context.getProcessingCommand().getCommand();
        retryExecutor.execute("FindEventByCommandId",
                () -> eventStore.find(command.getAggregateRootId(), command.getId()),
                existing -> {
                    if (existing.isPresent()) {
                        // applied before, the failure comes from redelivery
                        eventService.publishDomainEvent(context, existing.get());
                    } else if (exception instanceof PublishableException) {
                        publishException(context, (PublishableException) exception);
                    } else {
                        logCommandExecuteException(context, handlerType, exception);
                        completeCommand(context, CommandStatus.FAILED, exception.getClass().getSimpleName(),
                                exception.getMessage());
                    }
                },
                () -> "[commandId:" + command.getId() + "]",
                error -> logger.error(Markers.FATAL, "Looking up event stream of failed command {} gave up: {}",
                        command.getId(), error),
                true);
    }

    private void publishException(CommandExecuteContext context, PublishableException exception) {
        Command command = context.getProcessingCommand().getCommand();
        Throwable throwable = (Throwable) exception;
        retryExecutor.execute("PublishException",
                () -> exceptionPublisher.publish(exception),
                r -> completeCommand(context, CommandStatus.FAILED, throwable.getClass().getSimpleName(),
                        throwable.getMessage()),
                () -> {
                    Map<String, String> info = new LinkedHashMap<>();
                    exception.serializeTo(info);
                    return "[commandId:" + command.getId() + ", exceptionInfo:" + info + "]";
                },
                error -> logger.error(Markers.FATAL, "Publishing exception of command {} gave up: {}",
                        command.getId(), error),
                true);
    }

    private void logCommandExecuteException(CommandExecuteContext context, String handlerType,
            Exception exception) {
        Command command = context.getProcessingCommand().getCommand();
        logger.error("{} raised when {} handling {}. commandId: {}, aggregateRootId: {}",
                exception.getClass().getSimpleName(), handlerType,
                command.getClass().getSimpleName(), command.getId(), command.getAggregateRootId(), exception);
    }

    /**
     * Changes of a failed command are applied on the cached instance of its own aggregate. Dropping it from the cache
     * makes next command load the persisted state. Other aggregates are private copies and are left to the garbage
     * collector.
     */
    private void discardChanges(CommandExecuteContext context) {
        context.getTrackedAggregates().stream()
                .filter(AggregateRoot::hasChanges)
                .filter(a -> context.isOwnAggregate(a.getId()))
                .forEach(a -> memoryCache.remove(a.getId()));
    }

    // asynchronous handlers

    private void handleAsyncCommand(CommandExecuteContext context, CommandAsyncHandler<Command> handler,
            String handlerType) {
        if (handler.checkCommandHandledFirst()) {
            processAsyncCommand(context, handler, handlerType);
        } else {
            handleCommandAsync(context, handler, handlerType);
        }
    }

    private void processAsyncCommand(CommandExecuteContext context, CommandAsyncHandler<Command> handler,
            String handlerType) {
        Command command = context.getProcessingCommand().getCommand();
        retryExecutor.execute("GetCommand",
                () -> commandStore.get(command.getId()),
                existing -> {
                    if (existing.isPresent()) {
                        completeFromHandledCommand(context, existing.get());
                    } else {
                        handleCommandAsync(context, handler, handlerType);
                    }
                },
                () -> "[commandId:" + command.getId() + ", commandType:" + command.getClass().getSimpleName() + "]",
                error -> logger.error(Markers.FATAL, "Getting command {} from command store gave up: {}",
                        command.getId(), error),
                true);
    }

    private void handleCommandAsync(CommandExecuteContext context, CommandAsyncHandler<Command> handler,
            String handlerType) {
        Command command = context.getProcessingCommand().getCommand();
        retryExecutor.<ApplicationMessage>execute("HandleCommandAsync",
                () -> {
                    try {
                        CompletionStage<ApplicationMessage> result = handler.handleAsync(command);
                        logger.debug("Handle command async success. handlerType: {}, commandType: {}, "
                                + "commandId: {}, aggregateRootId: {}", handlerType,
                                command.getClass().getSimpleName(), command.getId(), command.getAggregateRootId());
                        return result;
                    } catch (IOException e) {
                        logger.error("Handle command async has io exception. handlerType: {}, commandType: {}, "
                                + "commandId: {}, aggregateRootId: {}", handlerType,
                                command.getClass().getSimpleName(), command.getId(), command.getAggregateRootId(), e);
                        return failed(e);
                    } catch (Exception e) {
                        logger.error("Handle command async has unknown exception. handlerType: {}, commandType: {}, "
                                + "commandId: {}, aggregateRootId: {}", handlerType,
                                command.getClass().getSimpleName(), command.getId(), command.getAggregateRootId(), e);
                        return failed(e);
                    }
                },
                message -> commitChanges(context, true, message, null),
                () -> "[command:[id:" + command.getId() + ", type:" + command.getClass().getSimpleName()
                        + "], handlerType:" + handlerType + "]",
                errorMessage -> commitChanges(context, false, null, errorMessage),
                false);
    }

    private static CompletionStage<ApplicationMessage> failed(Exception e) {
        CompletableFuture<ApplicationMessage> result = new CompletableFuture<>();
        result.completeExceptionally(e);
        return result;
    }

    private void commitChanges(CommandExecuteContext context, boolean success, ApplicationMessage message,
            String errorMessage) {
        Command command = context.getProcessingCommand().getCommand();
        HandledCommand handledCommand = ImmutableHandledCommand.builder()
                .commandId(command.getId())
                .aggregateRootId(command.getAggregateRootId())
                .message(message)
                .build();
        retryExecutor.execute("AddCommand",
                () -> commandStore.add(handledCommand),
                result -> {
                    if (result == CommandAddResult.SUCCESS) {
                        if (!success) {
                            completeCommand(context, CommandStatus.FAILED, String.class.getName(), errorMessage);
                        } else if (message != null) {
                            publishMessage(context, message);
                        } else {
                            completeCommand(context, CommandStatus.SUCCESS, null, null);
                        }
                    } else {
                        handleDuplicatedCommand(context);
                    }
                },
                () -> "[handledCommand:" + handledCommand + "]",
                error -> logger.error(Markers.FATAL, "Adding command {} to command store gave up: {}",
                        command.getId(), error),
                true);
    }

    private void handleDuplicatedCommand(CommandExecuteContext context) {
        Command command = context.getProcessingCommand().getCommand();
        retryExecutor.execute("GetCommand",
                () -> commandStore.get(command.getId()),
                existing -> {
                    if (existing.isPresent()) {
                        completeFromHandledCommand(context, existing.get());
                    } else {
                        String errorMessage = String.format("Command exist in the command store, but we cannot get "
                                + "it from the command store. commandType: %s, commandId: %s, aggregateRootId: %s",
                                command.getClass().getSimpleName(), command.getId(), command.getAggregateRootId());
                        logger.error(errorMessage);
                        completeCommand(context, CommandStatus.FAILED, null, errorMessage);
                    }
                },
                () -> "[command:[id:" + command.getId() + ", type:" + command.getClass().getSimpleName() + "]]",
                error -> logger.error(Markers.FATAL, "Getting command {} from command store gave up: {}",
                        command.getId(), error),
                true);
    }

    private void completeFromHandledCommand(CommandExecuteContext context, HandledCommand handledCommand) {
        if (handledCommand.getMessage().isPresent()) {
            publishMessage(context, handledCommand.getMessage().get());
        } else {
            completeCommand(context, CommandStatus.SUCCESS, null, null);
        }
    }

    private void publishMessage(CommandExecuteContext context, ApplicationMessage message) {
        Command command = context.getProcessingCommand().getCommand();
        retryExecutor.execute("PublishApplicationMessage",
                () -> applicationMessagePublisher.publish(message),
                r -> completeCommand(context, CommandStatus.SUCCESS, message.getTypeName(),
                        jsonSerializer.serialize(message)),
                () -> "[application message:[id:" + message.getId() + ", type:" + message.getClass().getSimpleName()
                        + "], command:[id:" + command.getId() + ", type:" + command.getClass().getSimpleName() + "]]",
                error -> logger.error(Markers.FATAL, "Publishing application message of command {} gave up: {}",
                        command.getId(), error),
                true);
    }

    private void completeCommand(CommandExecuteContext context, CommandStatus status, String resultType,
            String result) {
        Command command = context.getProcessingCommand().getCommand();
        context.complete(ImmutableCommandResult.builder()
                .status(status)
                .commandId(command.getId())
                .aggregateRootId(command.getAggregateRootId())
                .resultType(resultType)
                .result(result)
                .build());
    }

    private static <H> HandlerLookup<H> findHandler(List<HandlerRegistration<H>> registrations) {
        if (registrations == null || registrations.isEmpty()) {
            return new HandlerLookup<>(HandlerLookup.Outcome.NOT_FOUND, null, null);
        }
        if (registrations.size() > 1) {
            return new HandlerLookup<>(HandlerLookup.Outcome.TOO_MANY_REGISTRATIONS, null, null);
        }
        HandlerRegistration<H> registration = registrations.get(0);
        List<H> handlers = registration.getHandlers();
        if (handlers.isEmpty()) {
            return new HandlerLookup<>(HandlerLookup.Outcome.NOT_FOUND, null, null);
        }
        if (handlers.size() > 1) {
            return new HandlerLookup<>(HandlerLookup.Outcome.TOO_MANY_HANDLERS, null, null);
        }
        return new HandlerLookup<>(HandlerLookup.Outcome.FOUND, handlers.get(0), registration.getName());
    }

    private static final class HandlerLookup<H> {
        enum Outcome {
            FOUND, NOT_FOUND, TOO_MANY_REGISTRATIONS, TOO_MANY_HANDLERS
        }

        final Outcome outcome;
        final H handler;
        final String name;

        HandlerLookup(Outcome outcome, H handler, String name) {
            this.outcome = outcome;
            this.handler = handler;
            this.name = name;
        }
    }
}
