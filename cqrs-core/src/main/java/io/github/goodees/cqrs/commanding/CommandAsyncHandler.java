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

import io.github.goodees.cqrs.infrastructure.ApplicationMessage;

import java.util.concurrent.CompletionStage;

/**
 * Handler of commands that interact with systems outside of the runtime instead of changing aggregates. Its outcome
 * is recorded in {@link CommandStore}, and the application message it produces is published.
 * <p>A stage failing with {@link java.io.IOException} is retried, any other failure fails the command.</p>
 * @param <C> handled command type
 */
@FunctionalInterface
public interface CommandAsyncHandler<C extends Command> {

    /**
     * Handle the command.
     * @param command the command
     * @return stage completing with the message to publish, or null if there is nothing to publish
     * @throws Exception when handling fails synchronously
     */
    CompletionStage<ApplicationMessage> handleAsync(C command) throws Exception;

    /**
     * Whether command store should be consulted before the handler is invoked, so that redelivered command does not
     * call the external system again.
     * @return true to check the command store first
     */
    default boolean checkCommandHandledFirst() {
        return true;
    }
}
