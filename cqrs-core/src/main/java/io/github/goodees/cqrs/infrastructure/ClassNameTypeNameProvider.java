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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

final class ClassNameTypeNameProvider implements TypeNameProvider {
    static final ClassNameTypeNameProvider INSTANCE = new ClassNameTypeNameProvider();

    private final ConcurrentMap<String, Class<?>> resolved = new ConcurrentHashMap<>();

    private ClassNameTypeNameProvider() {
    }

    @Override
    public String getTypeName(Class<?> type) {
        return type.getName();
    }

    @Override
    public Class<?> getType(String typeName) {
        return resolved.computeIfAbsent(typeName, ClassNameTypeNameProvider::load);
    }

    private static Class<?> load(String typeName) {
        try {
            return Class.forName(typeName, true, Thread.currentThread().getContextClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown type name " + typeName, e);
        }
    }
}
