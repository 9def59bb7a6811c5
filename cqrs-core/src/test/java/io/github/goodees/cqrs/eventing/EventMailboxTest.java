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

import io.github.goodees.cqrs.CqrsConfiguration;
import io.github.goodees.cqrs.LogRecorder;
import io.github.goodees.cqrs.bank.AccountCreated;
import io.github.goodees.cqrs.bank.BankAccount;
import io.github.goodees.cqrs.bank.CreateAccount;
import io.github.goodees.cqrs.commanding.CommandExecuteContext;
import io.github.goodees.cqrs.commanding.ProcessingCommand;
import io.github.goodees.cqrs.domain.AggregateRootFactory;
import io.github.goodees.cqrs.domain.AggregateStorage;
import io.github.goodees.cqrs.domain.DefaultMemoryCache;
import io.github.goodees.cqrs.domain.EventSourcedAggregateStorage;
import io.github.goodees.cqrs.domain.MemoryCache;
import io.github.goodees.cqrs.infrastructure.TypeNameProvider;
import org.junit.Rule;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Executors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class EventMailboxTest {
    static final AggregateStorage storage = new EventSourcedAggregateStorage(AggregateRootFactory.reflective(),
            new InMemoryEventStore(), TypeNameProvider.classNames());
    static final MemoryCache cache = new DefaultMemoryCache(
            CqrsConfiguration.builder(Executors.newSingleThreadExecutor(), Executors.newSingleThreadScheduledExecutor())
                    .build(),
            storage, TypeNameProvider.classNames());

    @Rule
    public LogRecorder logs = new LogRecorder();

    // tasks submitted by the mailbox, run by the test itself
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final List<List<EventCommittingContext>> batches = new ArrayList<>();

    private EventMailbox mailbox(int batchSize) {
        return new EventMailbox("account-1", batchSize, tasks::add, batches::add);
    }

    private static EventCommittingContext context(long version) {
        ProcessingCommand command = new ProcessingCommand(new CreateAccount("account-1", "Alice"), null);
        BankAccount account = new BankAccount("account-1", "Alice");
        DomainEventStream stream = new DomainEventStream(command.getCommand().getId(), "account-1",
                BankAccount.class.getName(), version, Instant.now(),
                Collections.singletonList(new AccountCreated("Alice")), null);
        return new EventCommittingContext(account, stream, new CommandExecuteContext(command, cache, storage));
    }

    private void runTask() {
        Runnable task = tasks.poll();
        assertTrue("Mailbox should have scheduled a run", task != null);
        task.run();
    }

    @Test
    public void streams_are_taken_in_batches_of_configured_size() {
        EventMailbox mailbox = mailbox(2);
        List<EventCommittingContext> contexts = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            EventCommittingContext ctx = context(i);
            contexts.add(ctx);
            mailbox.enqueue(ctx);
            assertSame(mailbox, ctx.getEventMailbox());
        }
        assertEquals("Single run is scheduled for all streams", 1, tasks.size());

        runTask();
        assertThat(batches.get(0), contains(contexts.get(0), contexts.get(1)));
        assertThat("Next batch waits for the previous one", tasks, empty());

        mailbox.finishRun();
        runTask();
        mailbox.finishRun();
        runTask();
        assertThat(batches.get(1), contains(contexts.get(2), contexts.get(3)));
        assertThat(batches.get(2), contains(contexts.get(4)));

        mailbox.finishRun();
        assertThat(tasks, empty());
        assertTrue(mailbox.isIdle());
    }

    @Test
    public void stream_enqueued_during_flush_waits_for_it() {
        EventMailbox mailbox = mailbox(10);
        mailbox.enqueue(context(1));
        runTask();
        mailbox.enqueue(context(2));
        assertThat(tasks, empty());
        assertTrue(mailbox.isRunning());

        mailbox.finishRun();
        runTask();
        assertThat(batches, hasSize(2));
    }

    @Test
    public void cleared_mailbox_leaves_running_state_without_scheduling() {
        EventMailbox mailbox = mailbox(1);
        mailbox.enqueue(context(1));
        mailbox.enqueue(context(2));
        mailbox.enqueue(context(3));
        runTask();

        mailbox.clear();
        assertEquals(0, mailbox.getQueueSize());
        mailbox.exitHandlingMessage();
        assertFalse(mailbox.isRunning());
        assertThat(tasks, empty());

        mailbox.enqueue(context(2));
        runTask();
        assertThat(batches, hasSize(2));
    }

    @Test
    public void failing_batch_handler_is_fatal_and_frees_the_mailbox() {
        EventMailbox mailbox = new EventMailbox("account-1", 1, tasks::add, batch -> {
            throw new IllegalStateException("Store exploded");
        });
        mailbox.enqueue(context(1));
        mailbox.enqueue(context(2));
        runTask();
        assertThat(logs.fatalMessages(), not(empty()));
        assertEquals("Next batch is scheduled", 1, tasks.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void batch_size_must_be_positive() {
        mailbox(0);
    }
}
