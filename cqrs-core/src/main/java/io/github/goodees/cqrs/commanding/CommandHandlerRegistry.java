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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Explicit registry of command handlers, for deployments without a container that would discover them.
 * Handlers are matched by exact command class, and are adapted to accept any command by casting it to the type they
 * were registered for.
 */
public class CommandHandlerRegistry implements CommandHandlerProvider, CommandAsyncHandlerProvider {
    private final ConcurrentMap<Class<?>, List<HandlerRegistration<CommandHandler<Command>>>> handlers =
            new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, List<HandlerRegistration<CommandAsyncHandler<Command>>>> asyncHandlers =
            new ConcurrentHashMap<>();

    public <C extends Command> CommandHandlerRegistry register(Class<C> commandType,
            CommandHandler<? super C> handler) {
        return register(commandType, HandlerRegistration.of(handler.getClass().getName(), handler));
    }

    /**
     * Add a registration for command type.
     * @param commandType type of command
     * @param registration the registration
     * @param <C> command type
     * @return this registry
     */
    public <C extends Command> CommandHandlerRegistry register(Class<C> commandType,
            HandlerRegistration<? extends CommandHandler<? super C>> registration) {
        List<CommandHandler<Command>> typed = registration.getHandlers().stream()
                .<CommandHandler<Command>>map(h -> new TypedHandler<>(commandType, h))
                .collect(Collectors.toList());
        handlers.computeIfAbsent(commandType, t -> new CopyOnWriteArrayList<>())
                .add(HandlerRegistration.of(registration.getName(), typed));
        return this;
    }

    public <C extends Command> CommandHandlerRegistry registerAsync(Class<C> commandType,
            CommandAsyncHandler<? super C> handler) {
        return registerAsync(commandType, HandlerRegistration.of(handler.getClass().getName(), handler));
    }

    public <C extends Command> CommandHandlerRegistry registerAsync(Class<C> commandType,
            HandlerRegistration<? extends CommandAsyncHandler<? super C>> registration) {
        List<CommandAsyncHandler<Command>> typed = registration.getHandlers().stream()
                .<CommandAsyncHandler<Command>>map(h -> new TypedAsyncHandler<>(commandType, h))
                .collect(Collectors.toList());
        asyncHandlers.computeIfAbsent(commandType, t -> new CopyOnWriteArrayList<>())
                .add(HandlerRegistration.of(registration.getName(), typed));
        return this;
    }

    @Override
    public List<HandlerRegistration<CommandHandler<Command>>> getHandlers(Class<? extends Command> commandType) {
        return snapshot(handlers.get(commandType));
    }

    @Override
    public List<HandlerRegistration<CommandAsyncHandler<Command>>> getAsyncHandlers(
            Class<? extends Command> commandType) {
        return snapshot(asyncHandlers.get(commandType));
    }

    private static <T> List<T> snapshot(List<T> registrations) {
        return registrations == null ? Collections.emptyList() : new ArrayList<>(registrations);
    }

    private static final class TypedHandler<C extends Command> implements CommandHandler<Command> {
        private final Class<C> commandType;
        private final CommandHandler<? super C> handler;

        TypedHandler(Class<C> commandType, CommandHandler<? super C> handler) {
            this.commandType = commandType;
            this.handler = handler;
        }

        @Override
        public void handle(CommandContext context, Command command) throws Exception {
            handler.handle(context, commandType.cast(command));
        }
    }

    private static final class TypedAsyncHandler<C extends Command> implements CommandAsyncHandler<Command> {
        private final Class<C> commandType;
        private final CommandAsyncHandler<? super C> handler;

        TypedAsyncHandler(Class<C> commandType, CommandAsyncHandler<? super C> handler) {
            this.commandType = commandType;
            this.handler = handler;
        }

        @Override
        public CompletionStage<ApplicationMessage> handleAsync(Command command) throws Exception {
            return handler.handleAsync(commandType.cast(command));
        }

        @Override
        public boolean checkCommandHandledFirst() {
            return handler.checkCommandHandledFirst();
        }
    }
}
