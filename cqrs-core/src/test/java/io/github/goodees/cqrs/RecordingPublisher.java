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

import io.github.goodees.cqrs.infrastructure.MessagePublisher;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publisher remembering published messages. Can be told to fail with I/O exception for a number of attempts.
 */
public class RecordingPublisher<T> implements MessagePublisher<T> {
    private final List<T> published = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicInteger attempts = new AtomicInteger();

    @Override
    public CompletionStage<Void> publish(T message) {
        attempts.incrementAndGet();
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (failuresLeft.getAndDecrement() > 0) {
            result.completeExceptionally(new IOException("Broker unreachable"));
        } else {
            published.add(message);
            result.complete(null);
        }
        return result;
    }

    public void failNext(int times) {
        failuresLeft.set(times);
    }

    public List<T> getPublished() {
        return published;
    }

    public int getAttempts() {
        return attempts.get();
    }
}
