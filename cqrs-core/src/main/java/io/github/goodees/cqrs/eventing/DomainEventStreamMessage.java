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

import io.github.goodees.cqrs.domain.DomainEvent;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Published form of a persisted {@link DomainEventStream}.
 */
public final class DomainEventStreamMessage {
    private final String id;
    private final String commandId;
    private final DomainEventStream eventStream;
    private final Map<String, String> items;

    public DomainEventStreamMessage(String commandId, DomainEventStream eventStream, Map<String, String> items) {
        this.id = UUID.randomUUID().toString();
        this.commandId = Objects.requireNonNull(commandId, "Command id must be specified");
        this.eventStream = Objects.requireNonNull(eventStream, "Event stream must be specified");
        this.items = items;
    }

    public String getId() {
        return id;
    }

    public String getCommandId() {
        return commandId;
    }

    public String getAggregateRootId() {
        return eventStream.getAggregateRootId();
    }

    public String getAggregateRootTypeName() {
        return eventStream.getAggregateRootTypeName();
    }

    public long getVersion() {
        return eventStream.getVersion();
    }

    public List<DomainEvent> getEvents() {
        return eventStream.getEvents();
    }

    public Map<String, String> getItems() {
        return items;
    }

    @Override
    public String toString() {
        return "DomainEventStreamMessage{id=" + id + ", commandId=" + commandId + ", aggregateRootId="
                + getAggregateRootId() + ", version=" + getVersion() + ", events=" + getEvents() + "}";
    }
}
