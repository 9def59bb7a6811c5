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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Command store keeping records in memory.
 */
public class InMemoryCommandStore implements CommandStore {
    private final ConcurrentMap<String, HandledCommand> commands = new ConcurrentHashMap<>();

    @Override
    public CompletionStage<CommandAddResult> add(HandledCommand handledCommand) {
        HandledCommand previous = commands.putIfAbsent(handledCommand.getCommandId(), handledCommand);
        return CompletableFuture.completedFuture(previous == null
                ? CommandAddResult.SUCCESS : CommandAddResult.DUPLICATE_COMMAND);
    }

    @Override
    public CompletionStage<Optional<HandledCommand>> get(String commandId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(commands.get(commandId)));
    }

    public int size() {
        return commands.size();
    }
}
