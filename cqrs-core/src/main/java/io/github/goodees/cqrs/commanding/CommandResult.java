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

import io.github.goodees.cqrs.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * Outcome of a command, delivered exactly once per submission.
 */
@Value.Immutable
@ImmutablesSupport
public interface CommandResult {

    CommandStatus getStatus();

    String getCommandId();

    /**
     * Id of the target aggregate, absent when the command had none.
     * @return aggregate id
     */
    Optional<String> getAggregateRootId();

    /**
     * Result payload. A string set by the command handler, serialized application message, or failure reason.
     * @return the payload
     */
    Optional<String> getResult();

    /**
     * Type of the payload, e. g. {@code java.lang.String}, type name of application message, or simple name of
     * the exception that failed the command.
     * @return payload type
     */
    Optional<String> getResultType();

    default boolean isSuccessful() {
        return getStatus() != CommandStatus.FAILED;
    }
}
