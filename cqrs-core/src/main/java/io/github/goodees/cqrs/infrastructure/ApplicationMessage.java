package io.github.goodees.cqrs.infrastructure;

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
 * A message produced by an asynchronous command handler, e. g. the outcome of a call to another service. It is
 * recorded with the handled command and published to subscribers.
 */
public interface ApplicationMessage {

    /**
     * Unique identity of the message.
     * @return message id
     */
    String getId();

    /**
     * Type name under which the message is published and reported in command result.
     * @return type name, class name by default
     */
    default String getTypeName() {
        return getClass().getName();
    }
}
