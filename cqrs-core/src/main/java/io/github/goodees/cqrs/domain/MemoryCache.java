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

/**
 * In-memory overlay of latest known aggregate instances. The cache is updated optimistically as soon as an event
 * stream is accepted for persistence, and reloaded from storage whenever persistence reports a conflict. It is
 * never trusted over a store response.
 */
public interface MemoryCache {

    /**
     * Get cached aggregate, or load it from storage when it is not cached.
     * @param aggregateRootId aggregate id
     * @param type expected type
     * @param <T> expected type
     * @return the aggregate, or null if it does not exist
     * @throws IllegalArgumentException if cached aggregate is of different type
     */
    <T extends AggregateRoot> T get(String aggregateRootId, Class<T> type);

    /**
     * Store the aggregate as latest known state.
     * @param aggregateRoot the aggregate
     */
    void set(AggregateRoot aggregateRoot);

    /**
     * Replace cached state with state loaded from storage.
     * @param aggregateRootTypeName type name of the aggregate
     * @param aggregateRootId aggregate id
     */
    void refreshAggregateFromEventStore(String aggregateRootTypeName, String aggregateRootId);

    /**
     * Drop the aggregate, the next access will load it from storage.
     * @param aggregateRootId aggregate id
     * @return true if an aggregate was cached
     */
    boolean remove(String aggregateRootId);

    int size();
}
