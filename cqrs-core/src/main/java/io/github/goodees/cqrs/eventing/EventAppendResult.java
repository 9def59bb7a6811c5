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

/**
 * Business outcome of appending event streams. I/O failures are reported by failing the returned stage instead.
 */
public enum EventAppendResult {
    SUCCESS,
    /**
     * A stream of the same aggregate and version is already stored.
     */
    DUPLICATE_EVENT,
    /**
     * A stream of the same aggregate and command id is already stored.
     */
    DUPLICATE_COMMAND
}
