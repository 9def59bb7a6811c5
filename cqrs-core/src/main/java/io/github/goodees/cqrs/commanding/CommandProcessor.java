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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of commands into the runtime.
 */
public interface CommandProcessor {

    /**
     * Submit a command for processing.
     * @param command the command
     * @return future completing with result of the command. It never completes exceptionally.
     */
    default CompletableFuture<CommandResult> submit(Command command) {
        return submit(command, null);
    }

    /**
     * Submit a command along with context items.
     * @param command the command
     * @param items items passed along with event stream of the command, may be null
     * @return future completing with result of the command. It never completes exceptionally.
     */
    CompletableFuture<CommandResult> submit(Command command, Map<String, String> items);
}
