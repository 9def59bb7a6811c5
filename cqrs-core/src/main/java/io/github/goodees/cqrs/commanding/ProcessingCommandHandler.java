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
 * Executes commands dispatched by a {@link CommandMailbox}.
 * <p>Handler is responsible to eventually either complete the command through
 * {@link CommandMailbox#completeMessage(ProcessingCommand, long, CommandResult)}, or release the mailbox through
 * {@link CommandMailbox#tryExecuteNext(ProcessingCommand, long)}, for the dispatch number observed via
 * {@link ProcessingCommand#currentDispatch()} when the handling started. Until then no other command of the
 * mailbox is dispatched.</p>
 */
@FunctionalInterface
public interface ProcessingCommandHandler {

    void handle(ProcessingCommand processingCommand);
}
