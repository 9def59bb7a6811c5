package io.github.goodees.cqrs;

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

import io.github.goodees.cqrs.commanding.CommandAsyncHandlerProvider;
import io.github.goodees.cqrs.commanding.CommandHandlerProvider;
import io.github.goodees.cqrs.commanding.CommandHandlerRegistry;
import io.github.goodees.cqrs.commanding.CommandProcessor;
import io.github.goodees.cqrs.commanding.CommandStore;
import io.github.goodees.cqrs.commanding.DefaultCommandProcessor;
import io.github.goodees.cqrs.commanding.DefaultProcessingCommandHandler;
import io.github.goodees.cqrs.commanding.InMemoryCommandStore;
import io.github.goodees.cqrs.domain.AggregateRootFactory;
import io.github.goodees.cqrs.domain.DefaultMemoryCache;
import io.github.goodees.cqrs.domain.EventSourcedAggregateStorage;
import io.github.goodees.cqrs.domain.MemoryCache;
import io.github.goodees.cqrs.eventing.DefaultEventService;
import io.github.goodees.cqrs.eventing.DomainEventStreamMessage;
import io.github.goodees.cqrs.eventing.EventStore;
import io.github.goodees.cqrs.eventing.InMemoryEventStore;
import io.github.goodees.cqrs.infrastructure.ApplicationMessage;
import io.github.goodees.cqrs.infrastructure.JsonSerializer;
import io.github.goodees.cqrs.infrastructure.MessagePublisher;
import io.github.goodees.cqrs.infrastructure.PublishableException;
import io.github.goodees.cqrs.infrastructure.RetryExecutor;
import io.github.goodees.cqrs.infrastructure.TypeNameProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Assembled command processing runtime. Wires stores, publishers and handlers into the mailboxes and pipelines.
 * <p>Collaborators not given to the builder default to in-memory stores, publishers that drop messages, type names
 * based on class names, and aggregates instantiated reflectively.</p>
 */
public class CqrsRuntime {
    private static final Logger logger = LoggerFactory.getLogger(CqrsRuntime.class);

    private final CqrsConfiguration conf;
    private final DefaultMemoryCache memoryCache;
    private final DefaultEventService eventService;
    private final DefaultCommandProcessor commandProcessor;

    private CqrsRuntime(Builder b) {
        this.conf = b.conf;
        RetryExecutor retryExecutor = new RetryExecutor(conf);
        EventSourcedAggregateStorage storage = new EventSourcedAggregateStorage(b.aggregateRootFactory, b.eventStore,
                b.typeNameProvider);
        this.memoryCache = new DefaultMemoryCache(conf, storage, b.typeNameProvider);
        this.eventService = new DefaultEventService(conf, retryExecutor, memoryCache, b.eventStore,
                b.domainEventPublisher);
        DefaultProcessingCommandHandler handler = new DefaultProcessingCommandHandler(retryExecutor, memoryCache,
                storage, eventService, b.eventStore, b.commandStore, b.handlerProvider, b.asyncHandlerProvider,
                b.typeNameProvider, b.applicationMessagePublisher, b.exceptionPublisher, b.jsonSerializer);
        this.commandProcessor = new DefaultCommandProcessor(conf, handler);
    }

    public static Builder builder(CqrsConfiguration conf) {
        return new Builder(conf);
    }

    /**
     * Start background maintenance, i. e. removal of inactive aggregates from memory cache.
     */
    public void start() {
        memoryCache.start();
        logger.info("Started runtime with {}", conf);
    }

    /**
     * Stop background maintenance. Thread pools of configuration are owned by the caller and stay untouched.
     */
    public void shutdown() {
        memoryCache.shutdown();
        logger.info("Runtime stopped");
    }

    public CommandProcessor getCommandProcessor() {
        return commandProcessor;
    }

    public MemoryCache getMemoryCache() {
        return memoryCache;
    }

    /**
     * Drop mailboxes of an aggregate, that has no commands in flight.
     * @param aggregateRootId aggregate id
     * @return true if command mailbox was removed
     */
    public boolean removeIdleMailboxes(String aggregateRootId) {
        boolean removed = commandProcessor.removeIdleMailbox(aggregateRootId);
        eventService.removeIdleMailbox(aggregateRootId);
        return removed;
    }

    DefaultCommandProcessor processor() {
        return commandProcessor;
    }

    public static class Builder {
        private final CqrsConfiguration conf;
        private EventStore eventStore = new InMemoryEventStore();
        private CommandStore commandStore = new InMemoryCommandStore();
        private CommandHandlerProvider handlerProvider = new CommandHandlerRegistry();
        private CommandAsyncHandlerProvider asyncHandlerProvider = new CommandHandlerRegistry();
        private MessagePublisher<DomainEventStreamMessage> domainEventPublisher = MessagePublisher.discarding();
        private MessagePublisher<ApplicationMessage> applicationMessagePublisher = MessagePublisher.discarding();
        private MessagePublisher<PublishableException> exceptionPublisher = MessagePublisher.discarding();
        private TypeNameProvider typeNameProvider = TypeNameProvider.classNames();
        private AggregateRootFactory aggregateRootFactory = AggregateRootFactory.reflective();
        private JsonSerializer jsonSerializer = new JsonSerializer();

        Builder(CqrsConfiguration conf) {
            this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        }

        public Builder eventStore(EventStore eventStore) {
            this.eventStore = Objects.requireNonNull(eventStore);
            return this;
        }

        public Builder commandStore(CommandStore commandStore) {
            this.commandStore = Objects.requireNonNull(commandStore);
            return this;
        }

        /**
         * Use the registry for both synchronous and asynchronous handlers.
         * @param registry the registry
         * @return this builder
         */
        public Builder handlers(CommandHandlerRegistry registry) {
            this.handlerProvider = registry;
            this.asyncHandlerProvider = registry;
            return this;
        }

        public Builder handlers(CommandHandlerProvider handlerProvider,
                CommandAsyncHandlerProvider asyncHandlerProvider) {
            this.handlerProvider = Objects.requireNonNull(handlerProvider);
            this.asyncHandlerProvider = Objects.requireNonNull(asyncHandlerProvider);
            return this;
        }

        public Builder domainEventPublisher(MessagePublisher<DomainEventStreamMessage> publisher) {
            this.domainEventPublisher = Objects.requireNonNull(publisher);
            return this;
        }

        public Builder applicationMessagePublisher(MessagePublisher<ApplicationMessage> publisher) {
            this.applicationMessagePublisher = Objects.requireNonNull(publisher);
            return this;
        }

        public Builder exceptionPublisher(MessagePublisher<PublishableException> publisher) {
            this.exceptionPublisher = Objects.requireNonNull(publisher);
            return this;
        }

        public Builder typeNameProvider(TypeNameProvider typeNameProvider) {
            this.typeNameProvider = Objects.requireNonNull(typeNameProvider);
            return this;
        }

        public Builder aggregateRootFactory(AggregateRootFactory aggregateRootFactory) {
            this.aggregateRootFactory = Objects.requireNonNull(aggregateRootFactory);
            return this;
        }

        public Builder jsonSerializer(JsonSerializer jsonSerializer) {
            this.jsonSerializer = Objects.requireNonNull(jsonSerializer);
            return this;
        }

        public CqrsRuntime build() {
            return new CqrsRuntime(this);
        }
    }
}
