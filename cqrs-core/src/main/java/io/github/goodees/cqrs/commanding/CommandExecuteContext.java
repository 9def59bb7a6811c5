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
import io.github.goodees.cqrs.domain.MemoryCache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Context of single dispatch of a command. It tracks aggregates the handler touched, and identifies the dispatch
 * when the command is completed or releases its mailbox.
 * <p>Only the aggregate the command is addressed to comes from {@link MemoryCache}, as its mailbox serializes access
 * to the cached instance. Any other aggregate is loaded from {@link AggregateStorage} as a copy private to this
 * dispatch, so that changes of a failed command never reach an instance another mailbox works with.</p>
 */
public class CommandExecuteContext implements CommandContext {
    private final ProcessingCommand processingCommand;
    private final long dispatch;
    private final MemoryCache memoryCache;
    private final AggregateStorage storage;
    private final Map<String, AggregateRoot> trackedAggregates = new LinkedHashMap<>();
    private volatile String result;

    /**
     * Create context for current dispatch of the command.
     * @param processingCommand dispatched command
     * @param memoryCache the cache the command's own aggregate is read from
     * @param storage storage other aggregates are loaded from
     */
    public CommandExecuteContext(ProcessingCommand processingCommand, MemoryCache memoryCache,
            AggregateStorage storage) {
        this.processingCommand = Objects.requireNonNull(processingCommand, "Processing command must be specified");
        this.dispatch = processingCommand.currentDispatch();
        this.memoryCache = Objects.requireNonNull(memoryCache, "Memory cache must be specified");
        this.storage = Objects.requireNonNull(storage, "Aggregate storage must be specified");
    }

    @Override
    public void add(AggregateRoot aggregateRoot) {
        Objects.requireNonNull(aggregateRoot, "Aggregate must not be null");
        if (trackedAggregates.putIfAbsent(aggregateRoot.getId(), aggregateRoot) != null) {
            throw new IllegalArgumentException("Aggregate " + aggregateRoot.getClass().getSimpleName() + " with id "
                    + aggregateRoot.getId() + " already exists in command context");
        }
    }

    @Override
    public <T extends AggregateRoot> T get(String aggregateRootId, Class<T> type) {
        Objects.requireNonNull(aggregateRootId, "Aggregate id must be specified");
        AggregateRoot tracked = trackedAggregates.get(aggregateRootId);
        if (tracked != null) {
            if (!type.isInstance(tracked)) {
                throw new IllegalArgumentException("Aggregate " + aggregateRootId + " is "
                        + tracked.getClass().getName() + ", not " + type.getName());
            }
            return type.cast(tracked);
        }
        T aggregate = isOwnAggregate(aggregateRootId)
                ? memoryCache.get(aggregateRootId, type)
                : storage.get(type, aggregateRootId);
        if (aggregate == null) {
            throw new AggregateRootNotFoundException(aggregateRootId, type);
        }
        trackedAggregates.put(aggregateRootId, aggregate);
        return aggregate;
    }

    /**
     * Whether the aggregate is the one the command is addressed to, i. e. the one its mailbox owns.
     * @param aggregateRootId aggregate id
     * @return true for the command's own aggregate
     */
    public boolean isOwnAggregate(String aggregateRootId) {
        return aggregateRootId.equals(processingCommand.getCommand().getAggregateRootId());
    }

    @Override
    public void setResult(String result) {
        this.result = result;
    }

    @Override
    public String getResult() {
        return result;
    }

    public List<AggregateRoot> getTrackedAggregates() {
        return new ArrayList<>(trackedAggregates.values());
    }

    public ProcessingCommand getProcessingCommand() {
        return processingCommand;
    }

    public long getDispatch() {
        return dispatch;
    }

    /**
     * Whether the mailbox was rewound over this dispatch, so that its outcome must be discarded.
     * @return true if the dispatch is stale
     */
    public boolean isStale() {
        return processingCommand.isStale(dispatch);
    }

    /**
     * Deliver result of this dispatch.
     * @param commandResult the result
     */
    public void complete(CommandResult commandResult) {
        processingCommand.getMailbox().completeMessage(processingCommand, dispatch, commandResult);
    }

    /**
     * Let the mailbox continue with next command, while this one is still being persisted.
     */
    public void release() {
        processingCommand.getMailbox().tryExecuteNext(processingCommand, dispatch);
    }
}
