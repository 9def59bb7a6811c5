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

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Durable record of commands handled by asynchronous handlers. I/O problems are reported by completing
 * exceptionally with {@link java.io.IOException}.
 */
public interface CommandStore {

    /**
     * Record handled command, unless a record with the same command id exists.
     * @param handledCommand record to add
     * @return outcome of the add
     */
    CompletionStage<CommandAddResult> add(HandledCommand handledCommand);

    CompletionStage<Optional<HandledCommand>> get(String commandId);
}
