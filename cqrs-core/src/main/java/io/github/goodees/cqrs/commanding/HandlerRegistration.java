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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Handlers a single source, such as a handler class, declares for a command type. Runtime requires exactly one
 * registration with exactly one handler per command type.
 * @param <H> handler type
 */
public final class HandlerRegistration<H> {
    private final String name;
    private final List<H> handlers;

    private HandlerRegistration(String name, List<H> handlers) {
        this.name = Objects.requireNonNull(name, "Registration name must be specified");
        this.handlers = Collections.unmodifiableList(new ArrayList<>(handlers));
    }

    @SafeVarargs
    public static <H> HandlerRegistration<H> of(String name, H... handlers) {
        return new HandlerRegistration<>(name, Arrays.asList(handlers));
    }

    public static <H> HandlerRegistration<H> of(String name, List<? extends H> handlers) {
        return new HandlerRegistration<>(name, new ArrayList<>(handlers));
    }

    public String getName() {
        return name;
    }

    public List<H> getHandlers() {
        return handlers;
    }

    @Override
    public String toString() {
        return "HandlerRegistration[" + name + ", handlers=" + handlers.size() + "]";
    }
}
