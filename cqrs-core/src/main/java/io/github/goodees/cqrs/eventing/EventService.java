package io.github.goodees.cqrs.eventing;

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

import io.github.goodees.cqrs.commanding.CommandExecuteContext;

/**
 * Commits event streams produced by commands, and publishes them once persisted.
 */
public interface EventService {

    /**
     * Queue the stream for persistence, apply it to the memory cache and let the command mailbox continue.
     * @param context the stream with its origin
     */
    void commitDomainEvent(EventCommittingContext context);

    /**
     * Publish a persisted stream, and complete the command afterwards.
     * @param commandContext dispatch of the command the stream belongs to
     * @param eventStream persisted stream
     */
    void publishDomainEvent(CommandExecuteContext commandContext, DomainEventStream eventStream);
}
