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

import java.util.concurrent.CompletableFuture;

/**
 * Read-only CompletableFuture, given to submitters of commands. Only the runtime completes it.
 */
final class CommandResultFuture extends CompletableFuture<CommandResult> {

    @Override
    public boolean complete(CommandResult value) {
        throw new UnsupportedOperationException("Modifying command result from client is not allowed");
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw new UnsupportedOperationException("Modifying command result from client is not allowed");
    }

    /**
     * Submitted command cannot be withdrawn, it will be processed regardless of the caller waiting for it.
     * @param mayInterruptIfRunning ignored
     * @return false
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        return false;
    }

    @Override
    public void obtrudeValue(CommandResult value) {
        throw new UnsupportedOperationException("Modifying command result from client is not allowed");
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw new UnsupportedOperationException("Modifying command result from client is not allowed");
    }

    boolean doComplete(CommandResult value) {
        return super.complete(value);
    }
}
