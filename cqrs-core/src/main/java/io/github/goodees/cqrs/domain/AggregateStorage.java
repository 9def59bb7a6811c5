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
 * Loads the authoritative state of an aggregate.
 */
public interface AggregateStorage {

    /**
     * Load latest known state of an aggregate.
     * @param type aggregate type
     * @param aggregateRootId aggregate id
     * @param <T> aggregate type
     * @return the aggregate, or null if it has no history
     */
    <T extends AggregateRoot> T get(Class<T> type, String aggregateRootId);
}
