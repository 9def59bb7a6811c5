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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Versioned consistency boundary, whose history is persisted as a sequence of {@link DomainEventStream}s.
 * <p>An aggregate changes its state <strong>only</strong> in {@link #handleEvent(DomainEvent)}. Command handlers
 * call business methods of the aggregate, which validate the request and call {@link #applyEvent(DomainEvent)}.
 * Applied events stay uncommitted until the runtime persists them as single stream and calls
 * {@link #acceptChanges(long)}.</p>
 * <p>Version of a new aggregate is 0. Every committed stream increases it by exactly one.</p>
 */
public abstract class AggregateRoot {
    private final String id;
    private long version;
    private final List<DomainEvent> uncommittedEvents = new ArrayList<>();

    /**
     * Constructor for subclasses. Subclasses that are to be recovered by {@link AggregateRootFactory#reflective()}
     * need a constructor accepting only the id.
     * @param id identity of the aggregate
     */
    protected AggregateRoot(String id) {
        this.id = Objects.requireNonNull(id, "Aggregate id must be specified");
    }

    public final String getId() {
        return id;
    }

    /**
     * Version of the last committed stream.
     * @return version, 0 if nothing was committed yet
     */
    public final long getVersion() {
        return version;
    }

    /**
     * Apply new event. State is updated immediately, and the event is remembered as uncommitted change.
     * @param event the event
     */
    protected final void applyEvent(DomainEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        handleEvent(event);
        uncommittedEvents.add(event);
    }

    /**
     * Update the state as result of an event. Called both for new events and during replay of history, therefore
     * it may not throw nor validate anything.
     * @param event event to apply
     */
    protected abstract void handleEvent(DomainEvent event);

    /**
     * Events applied since the last commit.
     * @return ordered uncommitted events
     */
    public final List<DomainEvent> getChanges() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public final boolean hasChanges() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Mark uncommitted events as part of version {@code newVersion}.
     * @param newVersion version of the stream that contains the changes
     * @throws IllegalStateException if version does not follow current version
     */
    public final void acceptChanges(long newVersion) {
        if (newVersion != version + 1) {
            throw new IllegalStateException("Aggregate " + id + " of version " + version
                    + " cannot accept changes of version " + newVersion);
        }
        version = newVersion;
        uncommittedEvents.clear();
    }

    /**
     * Rebuild the state from persisted history.
     * @param eventStreams streams of this aggregate, ordered by version and starting right after current version
     * @throws IllegalStateException if the streams do not belong to this aggregate or do not follow each other
     */
    public final void replayEvents(Iterable<DomainEventStream> eventStreams) {
        for (DomainEventStream stream : eventStreams) {
            if (!id.equals(stream.getAggregateRootId())) {
                throw new IllegalStateException("Cannot replay stream of aggregate " + stream.getAggregateRootId()
                        + " on aggregate " + id);
            }
            if (stream.getVersion() != version + 1) {
                throw new IllegalStateException("Aggregate " + id + " of version " + version
                        + " cannot replay stream of version " + stream.getVersion());
            }
            stream.getEvents().forEach(this::handleEvent);
            version = stream.getVersion();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", version=" + version + ", uncommitted="
                + uncommittedEvents.size() + "]";
    }
}
