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

import io.github.goodees.cqrs.LogRecorder;
import io.github.goodees.cqrs.bank.Deposit;
import org.junit.Rule;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CommandMailboxTest {
    static final Executor direct = Runnable::run;

    @Rule
    public LogRecorder logs = new LogRecorder();

    private final List<ProcessingCommand> dispatched = new CopyOnWriteArrayList<>();
    private final CommandMailbox mailbox = new CommandMailbox("account-1", dispatched::add, direct);

    private static ProcessingCommand deposit(long amount) {
        return new ProcessingCommand(new Deposit("account-1", amount), null);
    }

    private static CommandResult success(ProcessingCommand command) {
        return ImmutableCommandResult.builder()
                .status(CommandStatus.SUCCESS)
                .commandId(command.getCommand().getId())
                .aggregateRootId(command.getCommand().getAggregateRootId())
                .build();
    }

    private void complete(ProcessingCommand command) {
        mailbox.completeMessage(command, command.currentDispatch(), success(command));
    }

    @Test
    public void commands_are_dispatched_one_at_a_time_in_order() {
        ProcessingCommand first = deposit(1), second = deposit(2), third = deposit(3);
        mailbox.enqueue(first);
        mailbox.enqueue(second);
        mailbox.enqueue(third);
        assertThat(dispatched, contains(first));
        assertTrue(mailbox.isRunning());

        complete(first);
        assertThat(dispatched, contains(first, second));
        assertTrue(first.getResult().isDone());
        assertFalse(second.getResult().isDone());

        complete(second);
        complete(third);
        assertThat(dispatched, contains(first, second, third));
        assertEquals(3, mailbox.getConsumingSequence());
        assertTrue(mailbox.isIdle());
    }

    @Test
    public void released_mailbox_continues_before_command_completes() {
        ProcessingCommand first = deposit(1), second = deposit(2);
        mailbox.enqueue(first);
        mailbox.enqueue(second);

        mailbox.tryExecuteNext(first, first.currentDispatch());
        assertThat(dispatched, contains(first, second));
        assertFalse(first.getResult().isDone());

        // completing a released dispatch must not release the mailbox again
        complete(first);
        assertThat(dispatched, contains(first, second));
        assertTrue(first.getResult().isDone());
        assertEquals(1, mailbox.getPendingCount());
    }

    @Test
    public void rewind_dispatches_commands_again_and_discards_stale_results() throws Exception {
        ProcessingCommand first = deposit(1), second = deposit(2);
        mailbox.enqueue(first);
        mailbox.enqueue(second);
        mailbox.tryExecuteNext(first, 1);
        mailbox.tryExecuteNext(second, 1);
        assertFalse(mailbox.isRunning());

        mailbox.stop();
        mailbox.resetConsumingOffset(0);
        assertTrue(first.isStale(1));
        assertTrue(second.isStale(1));

        mailbox.completeMessage(second, 1, success(second));
        assertFalse("Result of stale dispatch is discarded", second.getResult().isDone());
        assertThat(dispatched, contains(first, second));

        mailbox.restart();
        assertThat(dispatched, contains(first, second, first));
        assertEquals(2, first.currentDispatch());

        complete(first);
        assertThat(dispatched, contains(first, second, first, second));
        complete(second);
        assertEquals(CommandStatus.SUCCESS, second.getResult().get().getStatus());
        assertTrue(mailbox.isIdle());
    }

    @Test
    public void completed_commands_are_skipped_after_rewind() {
        ProcessingCommand first = deposit(1), second = deposit(2);
        mailbox.enqueue(first);
        mailbox.enqueue(second);
        complete(first);
        mailbox.tryExecuteNext(second, 1);

        mailbox.stop();
        mailbox.resetConsumingOffset(0);
        mailbox.restart();

        assertThat(dispatched, contains(first, second, second));
        assertFalse("Dispatch preceding the rewind point stays valid", first.isStale(1));
    }

    @Test
    public void paused_mailbox_dispatches_nothing_until_restarted() {
        mailbox.stop();
        ProcessingCommand command = deposit(1);
        mailbox.enqueue(command);
        assertThat(dispatched, empty());
        assertTrue(mailbox.isPaused());
        assertFalse(mailbox.isIdle());

        mailbox.restart();
        assertThat(dispatched, contains(command));
    }

    @Test(expected = IllegalStateException.class)
    public void command_cannot_be_enqueued_twice() {
        ProcessingCommand command = deposit(1);
        mailbox.enqueue(command);
        mailbox.enqueue(command);
    }

    @Test
    public void exception_escaping_the_handler_fails_the_command() throws Exception {
        CommandMailbox failing = new CommandMailbox("account-1", pc -> {
            throw new IllegalStateException("Handler bug");
        }, direct);
        ProcessingCommand command = deposit(1);
        failing.enqueue(command);

        CommandResult result = command.getResult().get();
        assertEquals(CommandStatus.FAILED, result.getStatus());
        assertEquals("IllegalStateException", result.getResultType().get());
        assertEquals("Handler bug", result.getResult().get());
        assertThat(logs.fatalMessages(), not(empty()));
        assertTrue(failing.isIdle());
    }

    @Test
    public void result_future_cannot_be_completed_by_client() {
        ProcessingCommand command = deposit(1);
        mailbox.enqueue(command);
        assertFalse(command.getResult().cancel(true));
        try {
            command.getResult().complete(success(command));
        } catch (UnsupportedOperationException e) {
            complete(command);
            assertTrue(command.getResult().isDone());
            return;
        }
        throw new AssertionError("Client completed command result");
    }
}
