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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unit of persistence: all events a single command produced on a single aggregate. Store guarantees that no two
 * streams of an aggregate share a version, and that a command id is recorded for an aggregate at most once.
 */
public final class DomainEventStream {
    /**
     * Item carrying the result string the command handler put into its context.
     */
    public static final String COMMAND_RESULT_ITEM = "CommandResult";

    private final String commandId;
    private final String aggregateRootId;
    private final String aggregateRootTypeName;
    private final long version;
    private final Instant timestamp;
    private final List<DomainEvent> events;
    private final Map<String, String> items;

    public DomainEventStream(String commandId, String aggregateRootId, String aggregateRootTypeName, long version,
            Instant timestamp, List<? extends DomainEvent> events, Map<String, String> items) {
        this.commandId = Objects.requireNonNull(commandId, "Command id must be specified");
        this.aggregateRootId = Objects.requireNonNull(aggregateRootId, "Aggregate id must be specified");
        this.aggregateRootTypeName = Objects.requireNonNull(aggregateRootTypeName,
                "Aggregate type name must be specified");
        if (version < 1) {
            throw new IllegalArgumentException("Version of event stream must be positive, was " + version);
        }
        this.version = version;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Event stream of aggregate " + aggregateRootId + " has no events");
        }
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.items = items == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(items));
    }

    public String getCommandId() {
        return commandId;
    }

    public String getAggregateRootId() {
        return aggregateRootId;
    }

    public String getAggregateRootTypeName() {
        return aggregateRootTypeName;
    }

    public long getVersion() {
        return version;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public List<DomainEvent> getEvents() {
        return events;
    }

    public Map<String, String> getItems() {
        return items;
    }

    @Override
    public String toString() {
        return "DomainEventStream{commandId=" + commandId + ", aggregateRootId=" + aggregateRootId
                + ", aggregateRootTypeName=" + aggregateRootTypeName + ", version=" + version
                + ", events=" + events + ", items=" + items + "}";
    }
}
