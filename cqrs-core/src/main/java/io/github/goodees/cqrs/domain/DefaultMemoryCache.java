package io.github.goodees.cqrs.domain;

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
import io.github.goodees.cqrs.infrastructure.TypeNameProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Memory cache backed by a concurrent map, loading missing aggregates from {@link AggregateStorage}.
 * <p>When {@link #start() started}, aggregates that were not accessed for
 * {@link CqrsConfiguration#aggregateMaxInactiveSeconds()} are periodically removed.</p>
 */
public class DefaultMemoryCache implements MemoryCache {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMemoryCache.class);

    private final ConcurrentMap<String, CachedAggregate> aggregates = new ConcurrentHashMap<>();
    private final CqrsConfiguration conf;
    private final AggregateStorage storage;
    private final TypeNameProvider typeNameProvider;
    private final LongSupplier clock;
    private ScheduledFuture<?> scavenger;

    public DefaultMemoryCache(CqrsConfiguration conf, AggregateStorage storage, TypeNameProvider typeNameProvider) {
        this(conf, storage, typeNameProvider, System::currentTimeMillis);
    }

    DefaultMemoryCache(CqrsConfiguration conf, AggregateStorage storage, TypeNameProvider typeNameProvider,
            LongSupplier clock) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.storage = Objects.requireNonNull(storage, "Aggregate storage must be specified");
        this.typeNameProvider = Objects.requireNonNull(typeNameProvider, "Type name provider must be specified");
        this.clock = clock;
    }

    @Override
    public <T extends AggregateRoot> T get(String aggregateRootId, Class<T> type) {
        Objects.requireNonNull(aggregateRootId, "Aggregate id must be specified");
        CachedAggregate cached = aggregates.get(aggregateRootId);
        if (cached != null) {
            if (!type.isInstance(cached.aggregate)) {
                throw new IllegalArgumentException("Incorrect aggregate type, expected " + type.getName()
                        + " but found " + cached.aggregate.getClass().getName() + " for id " + aggregateRootId);
            }
            cached.touch();
            return type.cast(cached.aggregate);
        }
        T loaded = storage.get(type, aggregateRootId);
        if (loaded != null) {
            set(loaded);
        }
        return loaded;
    }

    @Override
    public void set(AggregateRoot aggregateRoot) {
        Objects.requireNonNull(aggregateRoot, "Aggregate must not be null");
        aggregates.put(aggregateRoot.getId(), new CachedAggregate(aggregateRoot));
    }

    @Override
    public void refreshAggregateFromEventStore(String aggregateRootTypeName, String aggregateRootId) {
        Class<?> type = typeNameProvider.getType(aggregateRootTypeName);
        if (!AggregateRoot.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(aggregateRootTypeName + " is not an aggregate type");
        }
        AggregateRoot aggregate = storage.get(type.asSubclass(AggregateRoot.class), aggregateRootId);
        if (aggregate != null) {
            set(aggregate);
            logger.debug("Refreshed aggregate {} of type {} to version {}", aggregateRootId, aggregateRootTypeName,
                    aggregate.getVersion());
        } else {
            aggregates.remove(aggregateRootId);
            logger.debug("Aggregate {} of type {} has no history, removed from cache", aggregateRootId,
                    aggregateRootTypeName);
        }
    }

    @Override
    public boolean remove(String aggregateRootId) {
        return aggregates.remove(aggregateRootId) != null;
    }

    @Override
    public int size() {
        return aggregates.size();
    }

    /**
     * Start periodic removal of inactive aggregates.
     */
    public synchronized void start() {
        if (scavenger == null) {
            long interval = conf.scanExpiredAggregateIntervalMillis();
            scavenger = conf.schedulerService().scheduleAtFixedRate(this::cleanInactiveAggregates, interval, interval,
                    TimeUnit.MILLISECONDS);
        }
    }

    public synchronized void shutdown() {
        if (scavenger != null) {
            scavenger.cancel(false);
            scavenger = null;
        }
    }

    void cleanInactiveAggregates() {
        long threshold = clock.getAsLong() - TimeUnit.SECONDS.toMillis(conf.aggregateMaxInactiveSeconds());
        aggregates.entrySet().removeIf(e -> {
            if (e.getValue().lastAccess < threshold) {
                logger.info("Removed inactive aggregate {} from memory cache", e.getKey());
                return true;
            }
            return false;
        });
    }

    private class CachedAggregate {
        final AggregateRoot aggregate;
        volatile long lastAccess;

        CachedAggregate(AggregateRoot aggregate) {
            this.aggregate = aggregate;
            touch();
        }

        void touch() {
            lastAccess = clock.getAsLong();
        }
    }
}
