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

/**
 * Translates types to names stored with event streams and back.
 */
public interface TypeNameProvider {

    String getTypeName(Class<?> type);

    Class<?> getType(String typeName);

    /**
     * Provider using fully qualified class names, loading classes through context class loader of the calling
     * thread.
     * @return default type name provider
     */
    static TypeNameProvider classNames() {
        return ClassNameTypeNameProvider.INSTANCE;
    }
}
