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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable fact that became true in the business domain as result of applying a command to an aggregate.
 * <p>Aggregates define their own subclasses. Aggregate id and version are not carried by the event itself, they are
 * attributes of the {@link io.github.goodees.cqrs.eventing.DomainEventStream} the event is persisted in.</p>
 */
public abstract class DomainEvent {
    private final String id;
    private final Instant timestamp;

    protected DomainEvent() {
        this(UUID.randomUUID().toString(), Instant.now());
    }

    protected DomainEvent(String id, Instant timestamp) {
        this.id = Objects.requireNonNull(id, "Event id must be specified");
        this.timestamp = Objects.requireNonNull(timestamp, "Event timestamp must be specified");
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", timestamp=" + timestamp + "]";
    }
}
