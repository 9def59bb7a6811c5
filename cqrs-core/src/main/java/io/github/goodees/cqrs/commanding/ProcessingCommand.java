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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A command on its way through the runtime.
 * <p>The command may be executed multiple times when its mailbox rewinds after a concurrency conflict. Every
 * execution is a <em>dispatch</em>, numbered from 1. Rewind invalidates the dispatch in progress, and anything
 * produced by an invalid dispatch is discarded, because the command will be dispatched again.</p>
 */
public class ProcessingCommand {
    private final Command command;
    private final Map<String, String> items;
    private final CommandResultFuture result = new CommandResultFuture();
    private volatile CommandMailbox mailbox;
    private volatile long sequence = -1;
    private volatile long dispatch;
    private volatile long invalidatedDispatch;
    private final AtomicLong releasedDispatch = new AtomicLong();

    public ProcessingCommand(Command command, Map<String, String> items) {
        this.command = Objects.requireNonNull(command, "Command must be specified");
        this.items = items == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(items));
    }

    public Command getCommand() {
        return command;
    }

    /**
     * Context items given by submitter, they are passed along with the event stream of the command.
     * @return unmodifiable items
     */
    public Map<String, String> getItems() {
        return items;
    }

    public CommandMailbox getMailbox() {
        return mailbox;
    }

    public long getSequence() {
        return sequence;
    }

    public CompletableFuture<CommandResult> getResult() {
        return result;
    }

    void attach(CommandMailbox mailbox, long sequence) {
        if (this.mailbox != null) {
            throw new IllegalStateException("Command " + command.getId() + " is already enqueued");
        }
        this.mailbox = mailbox;
        this.sequence = sequence;
    }

    /**
     * Number of the latest dispatch.
     * @return dispatch number, 0 if never dispatched
     */
    public long currentDispatch() {
        return dispatch;
    }

    /**
     * Whether given dispatch was invalidated by a rewind of the mailbox.
     * @param dispatchNumber the dispatch
     * @return true if results of the dispatch are to be discarded
     */
    public boolean isStale(long dispatchNumber) {
        return dispatchNumber <= invalidatedDispatch;
    }

    // following are guarded by the mailbox
    long beginDispatch() {
        return ++dispatch;
    }

    void invalidateDispatch() {
        invalidatedDispatch = dispatch;
    }

    /**
     * Mark the dispatch as no longer occupying the mailbox.
     * @param dispatchNumber the dispatch
     * @return true for the first release of the dispatch
     */
    boolean release(long dispatchNumber) {
        return releasedDispatch.compareAndSet(dispatchNumber - 1, dispatchNumber);
    }

    boolean complete(CommandResult commandResult) {
        return result.doComplete(commandResult);
    }

    @Override
    public String toString() {
        return "ProcessingCommand[" + command + ", sequence=" + sequence + ", dispatch=" + dispatch + "]";
    }
}
