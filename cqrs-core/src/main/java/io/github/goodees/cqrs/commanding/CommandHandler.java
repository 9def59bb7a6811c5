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
 * Synchronous command handler. Loads aggregates through the context and invokes their business methods.
 * <p>Handler must change at most one aggregate. Exceptions thrown by the handler fail the command, unless the
 * command turns out to have been applied already.</p>
 * @param <C> handled command type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command> {

    void handle(CommandContext context, C command) throws Exception;
}
