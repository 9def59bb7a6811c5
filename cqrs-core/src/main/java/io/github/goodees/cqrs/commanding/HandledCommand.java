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
import io.github.goodees.cqrs.infrastructure.ApplicationMessage;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * Record of a command processed by an asynchronous handler. It is what makes repeated deliveries of such command
 * idempotent.
 */
@Value.Immutable
@ImmutablesSupport
public interface HandledCommand {

    String getCommandId();

    String getAggregateRootId();

    Optional<ApplicationMessage> getMessage();
}
