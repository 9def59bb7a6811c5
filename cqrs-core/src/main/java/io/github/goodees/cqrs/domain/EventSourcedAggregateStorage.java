package io.github.goodees.cqrs.domain;

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

import io.github.goodees.cqrs.eventing.DomainEventStream;
import io.github.goodees.cqrs.eventing.EventStore;
import io.github.goodees.cqrs.infrastructure.TypeNameProvider;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate storage recovering aggregates by replaying all of their event streams.
 */
public class EventSourcedAggregateStorage implements AggregateStorage {
    private final AggregateRootFactory factory;
    private final EventStore eventStore;
    private final TypeNameProvider typeNameProvider;

    public EventSourcedAggregateStorage(AggregateRootFactory factory, EventStore eventStore,
            TypeNameProvider typeNameProvider) {
        this.factory = Objects.requireNonNull(factory, "Aggregate factory must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.typeNameProvider = Objects.requireNonNull(typeNameProvider, "Type name provider must be specified");
    }

    @Override
    public <T extends AggregateRoot> T get(Class<T> type, String aggregateRootId) {
        Objects.requireNonNull(aggregateRootId, "Aggregate id must be specified");
        List<DomainEventStream> streams = eventStore.queryAggregateEvents(aggregateRootId,
                typeNameProvider.getTypeName(type), 1, Long.MAX_VALUE);
        if (streams.isEmpty()) {
            return null;
        }
        T aggregate = factory.create(type, aggregateRootId);
        aggregate.replayEvents(streams);
        return aggregate;
    }
}
