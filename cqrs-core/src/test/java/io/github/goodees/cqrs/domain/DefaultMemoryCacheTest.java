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
import io.github.goodees.cqrs.bank.AccountCreated;
import io.github.goodees.cqrs.bank.BankAccount;
import io.github.goodees.cqrs.bank.Deposited;
import io.github.goodees.cqrs.eventing.DomainEventStream;
import io.github.goodees.cqrs.eventing.InMemoryEventStore;
import io.github.goodees.cqrs.infrastructure.TypeNameProvider;
import org.junit.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class DefaultMemoryCacheTest {
    static ExecutorService executor = Executors.newSingleThreadExecutor();
    static ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    private final InMemoryEventStore store = new InMemoryEventStore();
    private final AtomicLong clock = new AtomicLong();
    private final CqrsConfiguration conf = CqrsConfiguration.builder(executor, scheduler)
            .aggregateMaxInactive(10, TimeUnit.SECONDS)
            .build();
    private final DefaultMemoryCache cache = cache(conf);

    static class Counter extends AggregateRoot {
        Counter(String id) {
            super(id);
        }

        @Override
        protected void handleEvent(DomainEvent event) {
        }
    }

    private DefaultMemoryCache cache(CqrsConfiguration configuration) {
        return new DefaultMemoryCache(configuration, new EventSourcedAggregateStorage(AggregateRootFactory.reflective(),
                store, TypeNameProvider.classNames()), TypeNameProvider.classNames(), clock::get);
    }

    private void persist(String commandId, long version, DomainEvent event) {
        store.append(new DomainEventStream(commandId, "account-1", BankAccount.class.getName(), version,
                Instant.now(), Collections.singletonList(event), null));
    }

    @Test
    public void missing_aggregate_is_loaded_from_history() {
        persist("c1", 1, new AccountCreated("Bob"));
        persist("c2", 2, new Deposited(50));

        BankAccount account = cache.get("account-1", BankAccount.class);
        assertEquals(2, account.getVersion());
        assertEquals("Bob", account.getOwner());
        assertEquals(50, account.getBalance());
        assertSame(account, cache.get("account-1", BankAccount.class));
        assertEquals(1, cache.size());
    }

    @Test
    public void aggregate_without_history_does_not_exist() {
        assertNull(cache.get("account-1", BankAccount.class));
        assertEquals(0, cache.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void cached_aggregate_of_other_type_is_rejected() {
        cache.set(new Counter("account-1"));
        cache.get("account-1", BankAccount.class);
    }

    @Test
    public void refresh_replaces_cached_state_with_stored_one() {
        persist("c1", 1, new AccountCreated("Bob"));
        BankAccount optimistic = new BankAccount("account-1", "Bob");
        optimistic.acceptChanges(1);
        optimistic.deposit(100);
        optimistic.acceptChanges(2);
        cache.set(optimistic);

        cache.refreshAggregateFromEventStore(BankAccount.class.getName(), "account-1");
        BankAccount refreshed = cache.get("account-1", BankAccount.class);
        assertEquals(1, refreshed.getVersion());
        assertEquals(0, refreshed.getBalance());
    }

    @Test
    public void refresh_without_history_removes_aggregate() {
        cache.set(new BankAccount("account-1", "Bob"));
        cache.refreshAggregateFromEventStore(BankAccount.class.getName(), "account-1");
        assertEquals(0, cache.size());
    }

    @Test
    public void inactive_aggregates_are_removed() {
        cache.set(new Counter("idle"));
        clock.set(TimeUnit.SECONDS.toMillis(5));
        cache.set(new Counter("active"));
        clock.set(TimeUnit.SECONDS.toMillis(12));

        cache.cleanInactiveAggregates();
        assertEquals(1, cache.size());
        assertNotNull(cache.get("active", Counter.class));
    }

    @Test
    public void access_keeps_aggregate_active() {
        cache.set(new Counter("counter"));
        clock.set(TimeUnit.SECONDS.toMillis(9));
        cache.get("counter", Counter.class);
        clock.set(TimeUnit.SECONDS.toMillis(15));

        cache.cleanInactiveAggregates();
        assertEquals(1, cache.size());
    }

    @Test
    public void started_cache_scans_for_inactive_aggregates() {
        DefaultMemoryCache scanned = cache(CqrsConfiguration.builder(executor, scheduler)
                .aggregateMaxInactive(1, TimeUnit.SECONDS)
                .scanExpiredAggregateInterval(10, TimeUnit.MILLISECONDS)
                .build());
        scanned.set(new Counter("counter"));
        clock.set(TimeUnit.SECONDS.toMillis(2));
        scanned.start();
        try {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (scanned.size() > 0 && System.nanoTime() < deadline) {
                LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(5));
            }
            assertEquals(0, scanned.size());
        } finally {
            scanned.shutdown();
        }
    }
}
