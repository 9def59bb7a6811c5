package io.github.goodees.cqrs;

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
import io.github.goodees.cqrs.eventing.EventAppendResult;
import io.github.goodees.cqrs.eventing.EventStore;
import io.github.goodees.cqrs.eventing.InMemoryEventStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory event store whose appends fail with I/O exception on demand.
 */
public class FlakyEventStore implements EventStore {
    private final InMemoryEventStore delegate;
    private final AtomicInteger appendFailuresLeft = new AtomicInteger();
    private final AtomicInteger appendAttempts = new AtomicInteger();

    public FlakyEventStore(boolean supportBatchAppend) {
        this.delegate = new InMemoryEventStore(supportBatchAppend);
    }

    public InMemoryEventStore getDelegate() {
        return delegate;
    }

    public void failNextAppends(int times) {
        appendFailuresLeft.set(times);
    }

    public int getAppendAttempts() {
        return appendAttempts.get();
    }

    @Override
    public boolean isSupportBatchAppend() {
        return delegate.isSupportBatchAppend();
    }

    @Override
    public CompletionStage<EventAppendResult> append(DomainEventStream eventStream) {
        return failOr(() -> delegate.append(eventStream));
    }

    @Override
    public CompletionStage<EventAppendResult> batchAppend(List<DomainEventStream> eventStreams) {
        return failOr(() -> delegate.batchAppend(eventStreams));
    }

    private CompletionStage<EventAppendResult> failOr(Supplier<CompletionStage<EventAppendResult>> append) {
        appendAttempts.incrementAndGet();
        if (appendFailuresLeft.getAndDecrement() > 0) {
            CompletableFuture<EventAppendResult> failed = new CompletableFuture<>();
            failed.completeExceptionally(new UncheckedIOException(new IOException("Connection reset")));
            return failed;
        }
        return append.get();
    }

    @Override
    public CompletionStage<Optional<DomainEventStream>> find(String aggregateRootId, long version) {
        return delegate.find(aggregateRootId, version);
    }

    @Override
    public CompletionStage<Optional<DomainEventStream>> find(String aggregateRootId, String commandId) {
        return delegate.find(aggregateRootId, commandId);
    }

    @Override
    public List<DomainEventStream> queryAggregateEvents(String aggregateRootId, String aggregateRootTypeName,
            long minVersion, long maxVersion) {
        return delegate.queryAggregateEvents(aggregateRootId, aggregateRootTypeName, minVersion, maxVersion);
    }
}
