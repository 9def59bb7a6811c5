package io.github.goodees.cqrs.commanding;

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

import io.github.goodees.cqrs.domain.AggregateRoot;

/**
 * View of the runtime given to a {@link CommandHandler}. Every aggregate the handler wants to change must be obtained
 * or added through the context, so that its changes are picked up after the handler returns.
 */
public interface CommandContext {

    /**
     * Register new aggregate created by the handler.
     * @param aggregateRoot new aggregate
     * @throws IllegalArgumentException if an aggregate with the same id is already tracked
     */
    void add(AggregateRoot aggregateRoot);

    /**
     * Get latest known state of an aggregate.
     * @param aggregateRootId aggregate id
     * @param type aggregate type
     * @param <T> aggregate type
     * @return the aggregate
     * @throws AggregateRootNotFoundException if the aggregate does not exist
     */
    <T extends AggregateRoot> T get(String aggregateRootId, Class<T> type);

    /**
     * Set result string that is returned to the submitter of the command.
     * @param result the result
     */
    void setResult(String result);

    String getResult();
}
