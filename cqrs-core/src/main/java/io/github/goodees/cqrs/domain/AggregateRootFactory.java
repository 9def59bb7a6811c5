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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Creates empty aggregate instances before their history is replayed.
 */
@FunctionalInterface
public interface AggregateRootFactory {

    <T extends AggregateRoot> T create(Class<T> type, String aggregateRootId);

    /**
     * Factory invoking a constructor accepting single String id. The constructor may be non-public.
     * @return reflective factory
     */
    static AggregateRootFactory reflective() {
        return new AggregateRootFactory() {
            @Override
            public <T extends AggregateRoot> T create(Class<T> type, String aggregateRootId) {
                try {
                    Constructor<T> constructor = type.getDeclaredConstructor(String.class);
                    constructor.setAccessible(true);
                    return constructor.newInstance(aggregateRootId);
                } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
                    throw new IllegalStateException("Aggregate type " + type.getName()
                            + " cannot be instantiated with id only", e);
                } catch (InvocationTargetException e) {
                    throw new IllegalStateException("Constructor of " + type.getName() + " failed", e.getCause());
                }
            }
        };
    }
}
