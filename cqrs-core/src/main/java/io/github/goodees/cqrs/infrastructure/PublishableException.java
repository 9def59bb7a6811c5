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

import java.util.Map;

/**
 * Marks an exception thrown from a command handler, that represents a domain signal rather than a failure.
 * Such exceptions are published to subscribers before the command is completed as failed.
 * <p>Implementations are exceptions, the interface is implemented alongside extending {@link RuntimeException}.
 * </p>
 */
public interface PublishableException {

    /**
     * Unique identity of the exception occurrence.
     * @return exception id
     */
    String getId();

    /**
     * Write the exception's state into the given map so that it can be transferred to subscribers.
     * @param serializableInfo target map
     */
    void serializeTo(Map<String, String> serializableInfo);
}
