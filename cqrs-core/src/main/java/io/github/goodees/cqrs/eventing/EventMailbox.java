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

import io.github.goodees.cqrs.infrastructure.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Queue of event streams of single aggregate waiting for persistence. Streams are taken in batches of at most the
 * configured size, and the next batch is taken only after the handler of the previous one calls
 * {@link #finishRun()} or {@link #exitHandlingMessage()}. There are never two batches of an aggregate in flight.
 */
public class EventMailbox implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(EventMailbox.class);

    private final String aggregateRootId;
    private final int batchSize;
    private final Executor executor;
    private final Consumer<List<EventCommittingContext>> handler;
    private final Queue<EventCommittingContext> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean running = new AtomicBoolean();

    public EventMailbox(String aggregateRootId, int batchSize, Executor executor,
            Consumer<List<EventCommittingContext>> handler) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        }
        this.aggregateRootId = aggregateRootId;
        this.batchSize = batchSize;
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
        this.handler = Objects.requireNonNull(handler, "Batch handler must be specified");
    }

    public void enqueue(EventCommittingContext context) {
        context.setEventMailbox(this);
        queue.add(context);
        registerForExecution();
    }

    void registerForExecution() {
        if (running.compareAndSet(false, true)) {
            try {
                executor.execute(this);
            } catch (RejectedExecutionException e) {
                running.set(false);
                throw e;
            }
        }
    }

    @Override
    public void run() {
        List<EventCommittingContext> batch = new ArrayList<>();
        EventCommittingContext context;
        while (batch.size() < batchSize && (context = queue.poll()) != null) {
            batch.add(context);
        }
        if (batch.isEmpty()) {
            finishRun();
            return;
        }
        logger.debug("Persisting batch of {} event streams of aggregate {}", batch.size(), aggregateRootId);
        try {
            handler.accept(batch);
        } catch (RuntimeException e) {
            logger.error(Markers.FATAL, "Persisting event streams of aggregate {} failed unexpectedly, {} streams lost",
                    aggregateRootId, batch.size(), e);
            finishRun();
        }
    }

    /**
     * Batch was handled, continue with the next one if any.
     */
    public void finishRun() {
        running.set(false);
        if (!queue.isEmpty()) {
            registerForExecution();
        }
    }

    /**
     * Leave running state without looking for more work. Used after {@link #clear()}, when the queue is refilled
     * by commands dispatched again.
     */
    public void exitHandlingMessage() {
        running.set(false);
    }

    /**
     * Drop all waiting streams.
     */
    public void clear() {
        int dropped = queue.size();
        queue.clear();
        logger.debug("Cleared {} event streams of aggregate {}", dropped, aggregateRootId);
    }

    public String getAggregateRootId() {
        return aggregateRootId;
    }

    public int getQueueSize() {
        return queue.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isIdle() {
        return !running.get() && queue.isEmpty();
    }
}
