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

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Log markers shared by the runtime.
 */
public final class Markers {
    /**
     * Marks errors that break an invariant between the runtime and its collaborators. Such entries require
     * operator attention, the runtime does not recover from them automatically.
     */
    public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    private Markers() {
    }
}
