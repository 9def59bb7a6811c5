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

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Settings and thread pools of the command processing runtime. The configuration is built once and passed to every
 * component that needs it, it is never changed afterwards.
 */
public final class CqrsConfiguration {
    public static final int UNLIMITED_RETRIES = -1;

    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final int eventMailboxPersistenceMaxBatchSize;
    private final int immediateRetries;
    private final long retryDelayMillis;
    private final int maxRetryAttempts;
    private final long aggregateMaxInactiveSeconds;
    private final long scanExpiredAggregateIntervalMillis;

    private CqrsConfiguration(Builder b) {
        this.executorService = Objects.requireNonNull(b.executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(b.schedulerService, "Scheduled executor must be specified");
        if (b.eventMailboxPersistenceMaxBatchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, was "
                    + b.eventMailboxPersistenceMaxBatchSize);
        }
        this.eventMailboxPersistenceMaxBatchSize = b.eventMailboxPersistenceMaxBatchSize;
        this.immediateRetries = Math.max(0, b.immediateRetries);
        this.retryDelayMillis = Math.max(0, b.retryDelayMillis);
        this.maxRetryAttempts = b.maxRetryAttempts < 0 ? UNLIMITED_RETRIES : b.maxRetryAttempts;
        this.aggregateMaxInactiveSeconds = b.aggregateMaxInactiveSeconds;
        this.scanExpiredAggregateIntervalMillis = b.scanExpiredAggregateIntervalMillis;
    }

    /**
     * The thread pool mailboxes and publications run on. Should usually be backed by multiple threads.
     * @return executor service
     */
    public ExecutorService executorService() {
        return executorService;
    }

    /**
     * Thread pool for delayed retries and cache scavenging. <strong>Should be different from executorService</strong>
     * so that retries are not starved by a busy worker pool.
     * @return scheduled executor service
     */
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    /**
     * Maximum number of event streams an event mailbox hands to the store at once.
     * @return batch size
     */
    public int eventMailboxPersistenceMaxBatchSize() {
        return eventMailboxPersistenceMaxBatchSize;
    }

    /**
     * Number of retries of a failed I/O operation that are performed without delay.
     * @return immediate retries
     */
    public int immediateRetries() {
        return immediateRetries;
    }

    /**
     * Delay before retrying a failed I/O operation once immediate retries are exhausted.
     * @return delay in milliseconds
     */
    public long retryDelayMillis() {
        return retryDelayMillis;
    }

    /**
     * Number of retries after which an I/O operation is given up and reported as fatal.
     * @return retry cap, or {@link #UNLIMITED_RETRIES}
     */
    public int maxRetryAttempts() {
        return maxRetryAttempts;
    }

    public long aggregateMaxInactiveSeconds() {
        return aggregateMaxInactiveSeconds;
    }

    public long scanExpiredAggregateIntervalMillis() {
        return scanExpiredAggregateIntervalMillis;
    }

    public static Builder builder(ExecutorService executorService, ScheduledExecutorService schedulerService) {
        return new Builder(executorService, schedulerService);
    }

    @Override
    public String toString() {
        return "CqrsConfiguration{batchSize=" + eventMailboxPersistenceMaxBatchSize
                + ", immediateRetries=" + immediateRetries + ", retryDelayMillis=" + retryDelayMillis
                + ", maxRetryAttempts=" + maxRetryAttempts
                + ", aggregateMaxInactiveSeconds=" + aggregateMaxInactiveSeconds + "}";
    }

    public static class Builder {
        private final ExecutorService executorService;
        private final ScheduledExecutorService schedulerService;
        private int eventMailboxPersistenceMaxBatchSize = 1000;
        private int immediateRetries = 3;
        private long retryDelayMillis = 1000;
        private int maxRetryAttempts = UNLIMITED_RETRIES;
        private long aggregateMaxInactiveSeconds = TimeUnit.DAYS.toSeconds(3);
        private long scanExpiredAggregateIntervalMillis = 5000;

        Builder(ExecutorService executorService, ScheduledExecutorService schedulerService) {
            this.executorService = executorService;
            this.schedulerService = schedulerService;
        }

        public Builder eventMailboxPersistenceMaxBatchSize(int batchSize) {
            this.eventMailboxPersistenceMaxBatchSize = batchSize;
            return this;
        }

        public Builder immediateRetries(int immediateRetries) {
            this.immediateRetries = immediateRetries;
            return this;
        }

        public Builder retryDelay(long delay, TimeUnit unit) {
            this.retryDelayMillis = unit.toMillis(delay);
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = maxRetryAttempts;
            return this;
        }

        public Builder aggregateMaxInactive(long duration, TimeUnit unit) {
            this.aggregateMaxInactiveSeconds = unit.toSeconds(duration);
            return this;
        }

        public Builder scanExpiredAggregateInterval(long interval, TimeUnit unit) {
            this.scanExpiredAggregateIntervalMillis = unit.toMillis(interval);
            return this;
        }

        public CqrsConfiguration build() {
            return new CqrsConfiguration(this);
        }
    }
}
