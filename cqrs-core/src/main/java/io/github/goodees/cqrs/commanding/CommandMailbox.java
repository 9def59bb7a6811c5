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

import io.github.goodees.cqrs.infrastructure.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue of commands of single aggregate. Guarantees that at most one command of the aggregate is being handled at a
 * time, while mailboxes of different aggregates run in parallel on a shared executor.
 * <p>Every enqueued command gets a sequence number. Mailbox dispatches commands in order of their sequences, and keeps
 * them until they are completed. That allows persistence to rewind the mailbox to an earlier sequence after it finds
 * out, that commands were executed against outdated state. Completed commands are skipped when the mailbox
 * passes them again.</p>
 * <p>States: <em>idle</em> when there is nothing to dispatch, <em>processing</em> from dispatch of a command until
 * the handler releases it, and <em>paused</em> between {@link #stop()} and {@link #restart()}.</p>
 */
public class CommandMailbox implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(CommandMailbox.class);

    private final String aggregateRootId;
    private final ProcessingCommandHandler handler;
    private final Executor executor;
    private final ConcurrentMap<Long, ProcessingCommand> messages = new ConcurrentHashMap<>();
    private final AtomicLong nextSequence = new AtomicLong();
    // guarded by this
    private long consumingSequence;
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile boolean paused;

    public CommandMailbox(String aggregateRootId, ProcessingCommandHandler handler, Executor executor) {
        this.aggregateRootId = aggregateRootId;
        this.handler = Objects.requireNonNull(handler, "Command handler must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
    }

    /**
     * Add a command to the end of the queue, and start processing if the mailbox is idle.
     * @param message command to enqueue
     */
    public void enqueue(ProcessingCommand message) {
        long sequence;
        synchronized (this) {
            sequence = nextSequence.get();
            message.attach(this, sequence);
            messages.put(sequence, message);
            nextSequence.set(sequence + 1);
        }
        logger.debug("Enqueued {} to mailbox of aggregate {} at sequence {}", message.getCommand(), aggregateRootId,
                sequence);
        registerForExecution();
    }

    void registerForExecution() {
        if (paused) {
            return;
        }
        if (running.compareAndSet(false, true)) {
            try {
                executor.execute(this);
            } catch (RejectedExecutionException e) {
                running.set(false);
                throw e;
            }
        }
    }

    /**
     * Dispatch the next command. Submitted to executor whenever the mailbox leaves idle state.
     */
    @Override
    public void run() {
        ProcessingCommand message = null;
        long dispatch = 0;
        synchronized (this) {
            while (!paused && consumingSequence < nextSequence.get()) {
                ProcessingCommand candidate = messages.get(consumingSequence);
                consumingSequence++;
                if (candidate != null) {
                    message = candidate;
                    dispatch = candidate.beginDispatch();
                    break;
                }
            }
            if (message == null) {
                running.set(false);
            }
        }
        if (message == null) {
            return;
        }
        logger.debug("Dispatching {} of aggregate {}, dispatch {}", message.getCommand(), aggregateRootId, dispatch);
        try {
            handler.handle(message);
        } catch (RuntimeException e) {
            logger.error(Markers.FATAL, "Handling of {} escaped the command handler", message, e);
            completeMessage(message, dispatch, ImmutableCommandResult.builder()
                    .status(CommandStatus.FAILED)
                    .commandId(message.getCommand().getId())
                    .aggregateRootId(message.getCommand().getAggregateRootId())
                    .resultType(e.getClass().getSimpleName())
                    .result(e.getMessage())
                    .build());
        }
    }

    /**
     * Deliver result of a command and release the mailbox. Result of invalidated dispatch is not delivered, the
     * command stays queued for its next dispatch.
     * @param message the command
     * @param dispatch the dispatch that produced the result
     * @param result the result
     */
    public void completeMessage(ProcessingCommand message, long dispatch, CommandResult result) {
        boolean deliver;
        synchronized (this) {
            deliver = !message.isStale(dispatch) && messages.remove(message.getSequence(), message);
        }
        if (deliver) {
            message.complete(result);
            logger.debug("Completed {} of aggregate {} with {}", message.getCommand(), aggregateRootId,
                    result.getStatus());
        } else {
            logger.debug("Discarded result {} of stale dispatch {} of {}", result.getStatus(), dispatch,
                    message.getCommand());
        }
        tryExecuteNext(message, dispatch);
    }

    /**
     * Release the mailbox held by a dispatch, so that next command can be dispatched. Only first call for a
     * dispatch has any effect.
     * @param message the command
     * @param dispatch the dispatch releasing the mailbox
     */
    public void tryExecuteNext(ProcessingCommand message, long dispatch) {
        if (message.release(dispatch)) {
            running.set(false);
            registerForExecution();
        }
    }

    /**
     * Stop dispatching. The command being handled is not affected.
     */
    public void stop() {
        paused = true;
        logger.debug("Paused mailbox of aggregate {}", aggregateRootId);
    }

    public void restart() {
        paused = false;
        logger.debug("Restarted mailbox of aggregate {}", aggregateRootId);
        registerForExecution();
    }

    /**
     * Rewind the mailbox, so that next dispatch starts from given sequence. Dispatches of all queued commands from
     * that sequence on become stale.
     * @param sequence the sequence to continue with
     */
    public synchronized void resetConsumingOffset(long sequence) {
        messages.forEach((seq, message) -> {
            if (seq >= sequence) {
                message.invalidateDispatch();
            }
        });
        logger.info("Reset consuming offset of aggregate {} from {} to {}", aggregateRootId, consumingSequence,
                sequence);
        consumingSequence = sequence;
    }

    public String getAggregateRootId() {
        return aggregateRootId;
    }

    public synchronized long getConsumingSequence() {
        return consumingSequence;
    }

    /**
     * Number of commands that were not completed yet.
     * @return pending commands
     */
    public int getPendingCount() {
        return messages.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Whether the mailbox can be dropped.
     * @return true when nothing is queued or being handled
     */
    public boolean isIdle() {
        return !running.get() && messages.isEmpty();
    }

    @Override
    public String toString() {
        return "CommandMailbox[" + aggregateRootId + ", next=" + nextSequence.get() + ", pending=" + messages.size()
                + ", running=" + running.get() + ", paused=" + paused + "]";
    }
}
