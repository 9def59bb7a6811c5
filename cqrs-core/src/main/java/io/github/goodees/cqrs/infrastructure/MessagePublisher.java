package io.github.goodees.cqrs.infrastructure;

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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Publishes messages to subscribers outside of the runtime. The runtime does not prescribe any transport.
 * <p>A publication that completes exceptionally will be retried by the runtime until it succeeds, therefore
 * implementations should report unreachable brokers with an {@link java.io.IOException}, and subscribers must
 * tolerate duplicate deliveries.</p>
 * @param <T> type of published message
 */
@FunctionalInterface
public interface MessagePublisher<T> {
    /**
     * Publish a message.
     * @param message the message to publish
     * @return stage that completes when the message was accepted by the transport
     */
    CompletionStage<Void> publish(T message);

    /**
     * Publisher for deployments that have no subscribers of given message type.
     * @param <T> type of published message
     * @return publisher that accepts and drops every message
     */
    static <T> MessagePublisher<T> discarding() {
        return message -> CompletableFuture.completedFuture(null);
    }
}
