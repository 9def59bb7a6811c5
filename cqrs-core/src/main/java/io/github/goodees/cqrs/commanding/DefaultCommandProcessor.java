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

import io.github.goodees.cqrs.CqrsConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Routes commands to mailboxes of their aggregates. Mailboxes are created on first command of an aggregate.
 * Commands without aggregate id share a mailbox, where they fail.
 */
public class DefaultCommandProcessor implements CommandProcessor {
    private static final Logger logger = LoggerFactory.getLogger(DefaultCommandProcessor.class);

    private final ConcurrentMap<String, CommandMailbox> mailboxes = new ConcurrentHashMap<>();
    private final CqrsConfiguration conf;
    private final ProcessingCommandHandler handler;

    public DefaultCommandProcessor(CqrsConfiguration conf, ProcessingCommandHandler handler) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.handler = Objects.requireNonNull(handler, "Processing command handler must be specified");
    }

    @Override
    public CompletableFuture<CommandResult> submit(Command command, Map<String, String> items) {
        Objects.requireNonNull(command, "Command must not be null");
        ProcessingCommand processingCommand = new ProcessingCommand(command, items);
        String aggregateRootId = command.getAggregateRootId() == null ? "" : command.getAggregateRootId();
        mailboxes.compute(aggregateRootId, (id, mailbox) -> {
            CommandMailbox target = mailbox != null ? mailbox
                    : new CommandMailbox(id, handler, conf.executorService());
            target.enqueue(processingCommand);
            return target;
        });
        return processingCommand.getResult();
    }

    /**
     * Drop mailbox of an aggregate if it has no pending commands.
     * @param aggregateRootId aggregate id
     * @return true if the mailbox was removed
     */
    public boolean removeIdleMailbox(String aggregateRootId) {
        boolean[] removed = new boolean[1];
        mailboxes.computeIfPresent(aggregateRootId, (id, mailbox) -> {
            removed[0] = mailbox.isIdle();
            return removed[0] ? null : mailbox;
        });
        if (removed[0]) {
            logger.debug("Removed idle command mailbox of aggregate {}", aggregateRootId);
        }
        return removed[0];
    }

    /**
     * Mailbox of an aggregate.
     * @param aggregateRootId aggregate id
     * @return the mailbox, or null if there is none
     */
    public CommandMailbox getMailbox(String aggregateRootId) {
        return mailboxes.get(aggregateRootId);
    }

    public int getMailboxCount() {
        return mailboxes.size();
    }
}
