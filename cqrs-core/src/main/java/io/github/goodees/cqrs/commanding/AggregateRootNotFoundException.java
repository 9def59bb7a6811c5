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

/**
 * Thrown to a command handler requesting an aggregate that has no history.
 */
public class AggregateRootNotFoundException extends RuntimeException {

    public AggregateRootNotFoundException(String aggregateRootId, Class<?> type) {
        super("Aggregate " + type.getSimpleName() + " with id " + aggregateRootId + " does not exist");
    }
}
