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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;

/**
 * Event store keeping streams in memory. Useful for tests and for single-node deployments that need no durability.
 */
public class InMemoryEventStore implements EventStore {
    private final boolean supportBatchAppend;
    private final Map<String, NavigableMap<Long, DomainEventStream>> streamsByVersion = new HashMap<>();
    private final Map<String, Map<String, DomainEventStream>> streamsByCommand = new HashMap<>();

    public InMemoryEventStore() {
        this(true);
    }

    public InMemoryEventStore(boolean supportBatchAppend) {
        this.supportBatchAppend = supportBatchAppend;
    }

    @Override
    public boolean isSupportBatchAppend() {
        return supportBatchAppend;
    }

    @Override
    public CompletionStage<EventAppendResult> append(DomainEventStream eventStream) {
        return CompletableFuture.completedFuture(store(Collections.singletonList(eventStream)));
    }

    @Override
    public CompletionStage<EventAppendResult> batchAppend(List<DomainEventStream> eventStreams) {
        if (!supportBatchAppend) {
            throw new UnsupportedOperationException("Batch append is disabled");
        }
        return CompletableFuture.completedFuture(store(eventStreams));
    }

    private synchronized EventAppendResult store(List<DomainEventStream> eventStreams) {
        Set<String> versions = new HashSet<>();
        for (DomainEventStream stream : eventStreams) {
            if (versionsOf(stream.getAggregateRootId()).containsKey(stream.getVersion())
                    || !versions.add(stream.getAggregateRootId() + "@" + stream.getVersion())) {
                return EventAppendResult.DUPLICATE_EVENT;
            }
        }
        Set<String> commands = new HashSet<>();
        for (DomainEventStream stream : eventStreams) {
            if (commandsOf(stream.getAggregateRootId()).containsKey(stream.getCommandId())
                    || !commands.add(stream.getAggregateRootId() + "@" + stream.getCommandId())) {
                return EventAppendResult.DUPLICATE_COMMAND;
            }
        }
        for (DomainEventStream stream : eventStreams) {
            versionsOf(stream.getAggregateRootId()).put(stream.getVersion(), stream);
            commandsOf(stream.getAggregateRootId()).put(stream.getCommandId(), stream);
        }
        return EventAppendResult.SUCCESS;
    }

    @Override
    public synchronized CompletionStage<Optional<DomainEventStream>> find(String aggregateRootId, long version) {
        return CompletableFuture.completedFuture(Optional.ofNullable(versionsOf(aggregateRootId).get(version)));
    }

    @Override
    public synchronized CompletionStage<Optional<DomainEventStream>> find(String aggregateRootId, String commandId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(commandsOf(aggregateRootId).get(commandId)));
    }

    @Override
    public synchronized List<DomainEventStream> queryAggregateEvents(String aggregateRootId,
            String aggregateRootTypeName, long minVersion, long maxVersion) {
        return versionsOf(aggregateRootId).subMap(minVersion, true, maxVersion, true).values().stream()
                .filter(s -> s.getAggregateRootTypeName().equals(aggregateRootTypeName))
                .collect(Collectors.toList());
    }

    /**
     * All stored streams of an aggregate.
     * @param aggregateRootId aggregate id
     * @return streams ordered by version
     */
    public synchronized List<DomainEventStream> getStreams(String aggregateRootId) {
        return new ArrayList<>(versionsOf(aggregateRootId).values());
    }

    private NavigableMap<Long, DomainEventStream> versionsOf(String aggregateRootId) {
        return streamsByVersion.computeIfAbsent(aggregateRootId, id -> new TreeMap<>());
    }

    private Map<String, DomainEventStream> commandsOf(String aggregateRootId) {
        return streamsByCommand.computeIfAbsent(aggregateRootId, id -> new HashMap<>());
    }
}
