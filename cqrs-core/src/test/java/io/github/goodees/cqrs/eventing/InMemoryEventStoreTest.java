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

import io.github.goodees.cqrs.bank.AccountCreated;
import io.github.goodees.cqrs.bank.BankAccount;
import io.github.goodees.cqrs.bank.Deposited;
import io.github.goodees.cqrs.domain.DomainEvent;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class InMemoryEventStoreTest {
    private final InMemoryEventStore store = new InMemoryEventStore();

    private static DomainEventStream stream(String commandId, String aggregateId, long version) {
        DomainEvent event = version == 1 ? new AccountCreated("Bob") : new Deposited(version);
        return new DomainEventStream(commandId, aggregateId, BankAccount.class.getName(), version, Instant.now(),
                Collections.singletonList(event), null);
    }

    private static <T> T await(CompletionStage<T> stage) throws Exception {
        return stage.toCompletableFuture().get(1, TimeUnit.SECONDS);
    }

    @Test
    public void appended_streams_are_found_by_version_and_command() throws Exception {
        assertEquals(EventAppendResult.SUCCESS, await(store.append(stream("c1", "a", 1))));
        assertEquals(EventAppendResult.SUCCESS, await(store.append(stream("c2", "a", 2))));

        assertEquals("c2", await(store.find("a", 2)).get().getCommandId());
        assertEquals(1, await(store.find("a", "c1")).get().getVersion());
        assertFalse(await(store.find("a", 3)).isPresent());
        assertFalse(await(store.find("b", "c1")).isPresent());
        assertEquals(2, store.queryAggregateEvents("a", BankAccount.class.getName(), 1, Long.MAX_VALUE).size());
        assertEquals(1, store.queryAggregateEvents("a", BankAccount.class.getName(), 2, 2).size());
        assertTrue(store.queryAggregateEvents("a", "other.Type", 1, Long.MAX_VALUE).isEmpty());
    }

    @Test
    public void duplicate_version_is_reported_before_duplicate_command() throws Exception {
        await(store.append(stream("c1", "a", 1)));
        assertEquals(EventAppendResult.DUPLICATE_EVENT, await(store.append(stream("c1", "a", 1))));
        assertEquals(EventAppendResult.DUPLICATE_EVENT, await(store.append(stream("c2", "a", 1))));
        assertEquals(EventAppendResult.DUPLICATE_COMMAND, await(store.append(stream("c1", "a", 2))));
    }

    @Test
    public void same_command_may_change_different_aggregates() throws Exception {
        await(store.append(stream("c1", "a", 1)));
        assertEquals(EventAppendResult.SUCCESS, await(store.append(stream("c1", "b", 1))));
    }

    @Test
    public void batch_is_stored_atomically() throws Exception {
        await(store.append(stream("c1", "a", 1)));
        assertEquals(EventAppendResult.DUPLICATE_COMMAND, await(store.batchAppend(Arrays.asList(
                stream("c2", "a", 2), stream("c1", "a", 3)))));
        assertEquals("Nothing of failed batch is stored", 1, store.getStreams("a").size());

        assertEquals(EventAppendResult.DUPLICATE_EVENT, await(store.batchAppend(Arrays.asList(
                stream("c2", "a", 2), stream("c3", "a", 2)))));
        assertEquals(EventAppendResult.SUCCESS, await(store.batchAppend(Arrays.asList(
                stream("c2", "a", 2), stream("c3", "a", 3)))));
        assertEquals(3, store.getStreams("a").size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void batch_append_can_be_disabled() {
        InMemoryEventStore oneByOne = new InMemoryEventStore(false);
        assertFalse(oneByOne.isSupportBatchAppend());
        oneByOne.batchAppend(Collections.singletonList(stream("c1", "a", 1)));
    }

    @Test
    public void missing_aggregate_has_no_streams() throws Exception {
        Optional<DomainEventStream> found = await(store.find("nobody", 1));
        assertFalse(found.isPresent());
        assertTrue(store.getStreams("nobody").isEmpty());
    }
}
