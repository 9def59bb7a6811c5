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

import java.util.Objects;
import java.util.UUID;

/**
 * Request to change single aggregate. Business commands extend this class and carry their payload as fields.
 * <p>Command id is the idempotence key of the runtime: a command id is applied to an aggregate at most once, no
 * matter how many times it is submitted.</p>
 */
public abstract class Command {
    private final String id;
    private final String aggregateRootId;

    protected Command(String aggregateRootId) {
        this(UUID.randomUUID().toString(), aggregateRootId);
    }

    /**
     * Constructor for commands with known identity, e. g. when redelivered by a transport.
     * @param id command id
     * @param aggregateRootId id of target aggregate. Commands without one are rejected during processing.
     */
    protected Command(String id, String aggregateRootId) {
        this.id = Objects.requireNonNull(id, "Command id must be specified");
        this.aggregateRootId = aggregateRootId;
    }

    public String getId() {
        return id;
    }

    public String getAggregateRootId() {
        return aggregateRootId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", aggregateRootId=" + aggregateRootId + "]";
    }
}
