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
import io.github.goodees.cqrs.commanding.ProcessingCommand;
import io.github.goodees.cqrs.domain.AggregateRoot;

import java.util.Objects;

/**
 * Event stream on its way to the event store, along with the aggregate and the command dispatch that produced it.
 */
public class EventCommittingContext {
    private final AggregateRoot aggregateRoot;
    private final DomainEventStream eventStream;
    private final CommandExecuteContext commandContext;
    private volatile EventMailbox eventMailbox;

    public EventCommittingContext(AggregateRoot aggregateRoot, DomainEventStream eventStream,
            CommandExecuteContext commandContext) {
        this.aggregateRoot = Objects.requireNonNull(aggregateRoot, "Aggregate must be specified");
        this.eventStream = Objects.requireNonNull(eventStream, "Event stream must be specified");
        this.commandContext = Objects.requireNonNull(commandContext, "Command context must be specified");
    }

    public AggregateRoot getAggregateRoot() {
        return aggregateRoot;
    }

    public DomainEventStream getEventStream() {
        return eventStream;
    }

    public CommandExecuteContext getCommandContext() {
        return commandContext;
    }

    public ProcessingCommand getProcessingCommand() {
        return commandContext.getProcessingCommand();
    }

    public EventMailbox getEventMailbox() {
        return eventMailbox;
    }

    void setEventMailbox(EventMailbox eventMailbox) {
        this.eventMailbox = eventMailbox;
    }

    @Override
    public String toString() {
        return "EventCommittingContext[" + eventStream + "]";
    }
}
