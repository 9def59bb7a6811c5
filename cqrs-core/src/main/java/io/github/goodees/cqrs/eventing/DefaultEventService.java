package io.github.goodees.cqrs.eventing;

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

import io.github.goodees.cqrs.CqrsConfiguration;
import io.github.goodees.cqrs.commanding.CommandExecuteContext;
import io.github.goodees.cqrs.commanding.CommandMailbox;
import io.github.goodees.cqrs.commanding.CommandResult;
import io.github.goodees.cqrs.commanding.CommandStatus;
import io.github.goodees.cqrs.commanding.ImmutableCommandResult;
import io.github.goodees.cqrs.commanding.ProcessingCommand;
import io.github.goodees.cqrs.domain.AggregateRoot;
import io.github.goodees.cqrs.domain.MemoryCache;
import io.github.goodees.cqrs.infrastructure.Markers;
import io.github.goodees.cqrs.infrastructure.MessagePublisher;
import io.github.goodees.cqrs.infrastructure.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Persists event streams through per-aggregate {@link EventMailbox}es and publishes them.
 * <p>Outcomes of persistence:</p>
 * <ul>
 *     <li>Success publishes the streams, and the mailbox continues with next batch.</li>
 *     <li>Duplicate version 1 means the aggregate was created before. If it was created by the same command, the
 *     stored stream is published again, otherwise the command fails.</li>
 *     <li>Duplicate version above 1 is a concurrency conflict. The command mailbox is rewound to the conflicting
 *     command, and the aggregate is reloaded from the store, so that the command runs again on current state.</li>
 *     <li>Duplicate command means the command was persisted before, its stored stream is published again.</li>
 * </ul>
 * <p>Every rewind holds the monitor of the command mailbox, and so does acceptance of a new stream, so that no
 * stream of a rewound dispatch enters an event mailbox after it was cleared.</p>
 */
public class DefaultEventService implements EventService {
    private static final Logger logger = LoggerFactory.getLogger(DefaultEventService.class);

    private final ConcurrentMap<String, EventMailbox> eventMailboxes = new ConcurrentHashMap<>();
    private final CqrsConfiguration conf;
    private final RetryExecutor retryExecutor;
    private final MemoryCache memoryCache;
    private final EventStore eventStore;
    private final MessagePublisher<DomainEventStreamMessage> domainEventPublisher;

    public DefaultEventService(CqrsConfiguration conf, RetryExecutor retryExecutor, MemoryCache memoryCache,
            EventStore eventStore, MessagePublisher<DomainEventStreamMessage> domainEventPublisher) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "Retry executor must be specified");
        this.memoryCache = Objects.requireNonNull(memoryCache, "Memory cache must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.domainEventPublisher = Objects.requireNonNull(domainEventPublisher,
                "Domain event publisher must be specified");
    }

    @Override
    public void commitDomainEvent(EventCommittingContext context) {
        CommandExecuteContext commandContext = context.getCommandContext();
        String aggregateRootId = context.getAggregateRoot().getId();
        synchronized (context.getProcessingCommand().getMailbox()) {
            if (commandContext.isStale()) {
                logger.debug("Discarding {} of stale dispatch {}", context.getEventStream(),
                        commandContext.getDispatch());
                if (commandContext.isOwnAggregate(aggregateRootId)) {
                    memoryCache.remove(aggregateRootId);
                }
            } else {
                eventMailboxes.compute(aggregateRootId, (id, mailbox) -> {
                    EventMailbox target = mailbox != null ? mailbox : new EventMailbox(id,
                            conf.eventMailboxPersistenceMaxBatchSize(), conf.executorService(), this::persist);
                    target.enqueue(context);
                    return target;
                });
                refreshAggregateMemoryCache(context);
            }
        }
        commandContext.release();
    }

    @Override
    public void publishDomainEvent(CommandExecuteContext commandContext, DomainEventStream eventStream) {
        ProcessingCommand processingCommand = commandContext.getProcessingCommand();
        Map<String, String> items = eventStream.getItems().isEmpty()
                ? processingCommand.getItems() : eventStream.getItems();
        DomainEventStreamMessage message = new DomainEventStreamMessage(processingCommand.getCommand().getId(),
                eventStream, items);
        retryExecutor.execute("PublishEvent",
                () -> domainEventPublisher.publish(message),
                r -> {
                    logger.debug("Published {}", message);
                    String result = eventStream.getItems().getOrDefault(DomainEventStream.COMMAND_RESULT_ITEM,
                            commandContext.getResult());
                    completeCommand(commandContext, ImmutableCommandResult.builder()
                            .status(CommandStatus.SUCCESS)
                            .commandId(processingCommand.getCommand().getId())
                            .aggregateRootId(eventStream.getAggregateRootId())
                            .result(result)
                            .resultType(result != null ? String.class.getName() : null)
                            .build());
                },
                () -> "[eventStream:" + eventStream + "]",
                error -> logger.error(Markers.FATAL, "Publishing {} gave up, command {} stays incomplete: {}",
                        eventStream, processingCommand.getCommand().getId(), error),
                true);
    }

    /**
     * Drop event mailbox of an aggregate, if it has no work.
     * @param aggregateRootId aggregate id
     * @return true if mailbox was removed
     */
    public boolean removeIdleMailbox(String aggregateRootId) {
        boolean[] removed = new boolean[1];
        eventMailboxes.computeIfPresent(aggregateRootId, (id, mailbox) -> {
            removed[0] = mailbox.isIdle();
            return removed[0] ? null : mailbox;
        });
        return removed[0];
    }

    EventMailbox getEventMailbox(String aggregateRootId) {
        return eventMailboxes.get(aggregateRootId);
    }

    void persist(List<EventCommittingContext> batch) {
        if (eventStore.isSupportBatchAppend()) {
            batchPersist(batch);
        } else {
            persistOneByOne(batch, 0);
        }
    }

    private void batchPersist(List<EventCommittingContext> batch) {
        EventMailbox eventMailbox = batch.get(0).getEventMailbox();
        List<DomainEventStream> streams = batch.stream().map(EventCommittingContext::getEventStream)
                .collect(Collectors.toList());
        retryExecutor.execute("BatchPersistEvent",
                () -> eventStore.batchAppend(streams),
                result -> {
                    switch (result) {
                        case SUCCESS:
                            logger.debug("Batch persisted {} event streams of aggregate {}", batch.size(),
                                    eventMailbox.getAggregateRootId());
                            conf.executorService().execute(() -> batch.forEach(
                                    c -> publishDomainEvent(c.getCommandContext(), c.getEventStream())));
                            eventMailbox.finishRun();
                            break;
                        case DUPLICATE_EVENT:
                            handleDuplicateEvent(batch.get(0), batch.size());
                            break;
                        case DUPLICATE_COMMAND:
                            persistOneByOne(batch, 0);
                            break;
                        default:
                            throw new IllegalStateException("Unknown append result " + result);
                    }
                },
                () -> "[aggregateRootId:" + eventMailbox.getAggregateRootId() + ", contextListCount:" + batch.size()
                        + "]",
                error -> logger.error(Markers.FATAL, "Batch persist of aggregate {} gave up, event mailbox is stalled: {}",
                        eventMailbox.getAggregateRootId(), error),
                true);
    }

    private void persistOneByOne(List<EventCommittingContext> batch, int index) {
        EventCommittingContext context = batch.get(index);
        retryExecutor.execute("PersistEvent",
                () -> eventStore.append(context.getEventStream()),
                result -> {
                    switch (result) {
                        case SUCCESS:
                            logger.debug("Persisted {}", context.getEventStream());
                            conf.executorService().execute(() -> publishDomainEvent(context.getCommandContext(),
                                    context.getEventStream()));
                            if (index + 1 < batch.size()) {
                                conf.executorService().execute(() -> persistOneByOne(batch, index + 1));
                            } else {
                                context.getEventMailbox().finishRun();
                            }
                            break;
                        case DUPLICATE_EVENT:
                            handleDuplicateEvent(context, 1);
                            break;
                        case DUPLICATE_COMMAND:
                            logger.warn("Persist event has duplicate command, {}", context.getEventStream());
                            resetCommandMailboxConsumingOffset(context, context.getProcessingCommand().getSequence() + 1);
                            tryToRepublishEvent(context);
                            break;
                        default:
                            throw new IllegalStateException("Unknown append result " + result);
                    }
                },
                () -> "[eventStream:" + context.getEventStream() + "]",
                error -> logger.error(Markers.FATAL, "Persist of {} gave up, event mailbox is stalled: {}",
                        context.getEventStream(), error),
                true);
    }

    private void handleDuplicateEvent(EventCommittingContext context, int batchSize) {
        if (context.getEventStream().getVersion() == 1) {
            handleFirstEventDuplication(context);
        } else {
            logger.warn("Persist event has concurrent version conflict, first eventStream: {}, batchSize: {}",
                    context.getEventStream(), batchSize);
            resetCommandMailboxConsumingOffset(context, context.getProcessingCommand().getSequence());
        }
    }

    private void handleFirstEventDuplication(EventCommittingContext context) {
        DomainEventStream eventStream = context.getEventStream();
        ProcessingCommand processingCommand = context.getProcessingCommand();
        retryExecutor.execute("FindFirstEventByVersion",
                () -> eventStore.find(eventStream.getAggregateRootId(), 1),
                found -> {
                    if (!found.isPresent()) {
                        logger.error(Markers.FATAL, "Duplicate aggregate creation, but the existing event stream "
                                + "cannot be found in event store. commandId: {}, aggregateRootId: {}, "
                                + "aggregateRootTypeName: {}", eventStream.getCommandId(),
                                eventStream.getAggregateRootId(), eventStream.getAggregateRootTypeName());
                        return;
                    }
                    DomainEventStream firstEventStream = found.get();
                    String commandId = processingCommand.getCommand().getId();
                    resetCommandMailboxConsumingOffset(context, processingCommand.getSequence() + 1);
                    if (commandId.equals(firstEventStream.getCommandId())) {
                        publishDomainEvent(context.getCommandContext(), firstEventStream);
                    } else {
                        logger.error("Duplicate aggregate creation. current commandId: {}, existing commandId: {}, "
                                + "aggregateRootId: {}, aggregateRootTypeName: {}", commandId,
                                firstEventStream.getCommandId(), firstEventStream.getAggregateRootId(),
                                firstEventStream.getAggregateRootTypeName());
                        completeCommand(context.getCommandContext(), ImmutableCommandResult.builder()
                                .status(CommandStatus.FAILED)
                                .commandId(commandId)
                                .aggregateRootId(eventStream.getAggregateRootId())
                                .result("Duplicate aggregate creation.")
                                .resultType(String.class.getName())
                                .build());
                    }
                },
                () -> "[eventStream:" + eventStream + "]",
                error -> logger.error(Markers.FATAL, "Looking up first event stream of aggregate {} gave up: {}",
                        eventStream.getAggregateRootId(), error),
                true);
    }

    private void tryToRepublishEvent(EventCommittingContext context) {
        ProcessingCommand processingCommand = context.getProcessingCommand();
        String aggregateRootId = context.getEventStream().getAggregateRootId();
        String commandId = processingCommand.getCommand().getId();
        retryExecutor.execute("FindEventByCommandId",
                () -> eventStore.find(aggregateRootId, commandId),
                found -> {
                    if (found.isPresent()) {
                        publishDomainEvent(context.getCommandContext(), found.get());
                    } else {
                        logger.error(Markers.FATAL, "Command exists in the event store, but it cannot be found there. "
                                + "commandType: {}, commandId: {}, aggregateRootId: {}",
                                processingCommand.getCommand().getClass().getSimpleName(), commandId, aggregateRootId);
                    }
                },
                () -> "[aggregateRootId:" + aggregateRootId + ", commandId:" + commandId + "]",
                error -> logger.error(Markers.FATAL, "Looking up event stream of command {} gave up: {}", commandId,
                        error),
                true);
    }

    private void resetCommandMailboxConsumingOffset(EventCommittingContext context, long consumingSequence) {
        EventMailbox eventMailbox = context.getEventMailbox();
        CommandMailbox commandMailbox = context.getProcessingCommand().getMailbox();
        synchronized (commandMailbox) {
            commandMailbox.stop();
            updateAggregateMemoryCacheToLatestVersion(context.getEventStream());
            commandMailbox.resetConsumingOffset(consumingSequence);
            eventMailbox.clear();
            eventMailbox.exitHandlingMessage();
        }
        commandMailbox.restart();
    }

    private void refreshAggregateMemoryCache(EventCommittingContext context) {
        AggregateRoot aggregateRoot = context.getAggregateRoot();
        if (!context.getCommandContext().isOwnAggregate(aggregateRoot.getId())) {
            // private copy, the owning mailbox reloads it
            memoryCache.remove(aggregateRoot.getId());
            return;
        }
        try {
            aggregateRoot.acceptChanges(context.getEventStream().getVersion());
            memoryCache.set(aggregateRoot);
        } catch (RuntimeException e) {
            logger.error("Refresh memory cache failed for {}", context.getEventStream(), e);
            memoryCache.remove(aggregateRoot.getId());
        }
    }

    private void updateAggregateMemoryCacheToLatestVersion(DomainEventStream eventStream) {
        try {
            memoryCache.refreshAggregateFromEventStore(eventStream.getAggregateRootTypeName(),
                    eventStream.getAggregateRootId());
        } catch (RuntimeException e) {
            logger.error("Refreshing aggregate from event store failed, {}", eventStream, e);
            memoryCache.remove(eventStream.getAggregateRootId());
        }
    }

    private void completeCommand(CommandExecuteContext commandContext, CommandResult result) {
        commandContext.complete(result);
        logger.info("Complete command {}, aggregateId: {}, status: {}", result.getCommandId(),
                result.getAggregateRootId().orElse(null), result.getStatus());
    }
}
