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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Typesafe and boilerplate-free routing of events to state changes. Serves aggregates to implement
 * {@link AggregateRoot#handleEvent(DomainEvent)} without chains of instanceof checks. It is linear to number of
 * branches, and terminates on first match.
 */
public class EventRouter {

    private final List<Branch<?>> branches;

    private EventRouter(Builder b) {
        this.branches = new ArrayList<>(b.branches);
    }

    /**
     * Pass the event to the first matching handler.
     * @param event event to route
     * @return true if any branch matched
     */
    public boolean route(DomainEvent event) {
        for (Branch<?> branch : branches) {
            if (branch.match(event)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        protected List<Branch<?>> branches = new ArrayList<>();
        protected Branch<DomainEvent> fallback;

        public <T extends DomainEvent> Builder on(Class<T> clazz, Consumer<T> handler) {
            return on(clazz, null, handler);
        }

        public <T extends DomainEvent> Builder on(Class<T> clazz, Predicate<T> predicate, Consumer<T> handler) {
            this.branches.add(new Branch<>(clazz, predicate, handler));
            return this;
        }

        public Builder otherwise(Consumer<DomainEvent> fallback) {
            this.fallback = new Branch<>(DomainEvent.class, null, fallback);
            return this;
        }

        public EventRouter build() {
            if (fallback != null) {
                branches.add(fallback);
            }
            return new EventRouter(this);
        }

    }

    private static class Branch<T extends DomainEvent> {

        private final Class<T> eventClass;
        private final Predicate<T> check;
        private final Consumer<T> handler;

        Branch(Class<T> eventClass, Predicate<T> check, Consumer<T> handler) {
            this.eventClass = Objects.requireNonNull(eventClass, "Event class cannot be null");
            this.check = check;
            this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        }

        boolean match(DomainEvent event) {
            if (event != null && eventClass.isInstance(event)) {
                T inst = eventClass.cast(event);
                if (check == null || check.test(inst)) {
                    handler.accept(inst);
                    return true;
                }
            }
            return false;
        }
    }
}
