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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Durable store of event streams.
 * <p>Asynchronous operations report business outcomes as results, and I/O problems by completing exceptionally with
 * {@link java.io.IOException} as (a cause of) the failure. The runtime retries the latter until the store
 * cooperates.</p>
 */
public interface EventStore {

    /**
     * Whether {@link #batchAppend(List)} may be used.
     * @return true if the store can append multiple streams atomically
     */
    boolean isSupportBatchAppend();

    /**
     * Append single stream. Duplicate version is checked before duplicate command.
     * @param eventStream stream to append
     * @return outcome of the append
     */
    CompletionStage<EventAppendResult> append(DomainEventStream eventStream);

    /**
     * Append streams of single aggregate atomically. Either all are stored or none.
     * @param eventStreams streams ordered by version
     * @return outcome of the append
     */
    CompletionStage<EventAppendResult> batchAppend(List<DomainEventStream> eventStreams);

    CompletionStage<Optional<DomainEventStream>> find(String aggregateRootId, long version);

    CompletionStage<Optional<DomainEventStream>> find(String aggregateRootId, String commandId);

    /**
     * Read history of an aggregate.
     * @param aggregateRootId aggregate id
     * @param aggregateRootTypeName aggregate type name
     * @param minVersion minimal version, inclusive
     * @param maxVersion maximal version, inclusive
     * @return streams ordered by version
     */
    List<DomainEventStream> queryAggregateEvents(String aggregateRootId, String aggregateRootTypeName, long minVersion,
            long maxVersion);
}
