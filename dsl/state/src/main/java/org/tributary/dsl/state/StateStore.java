/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.dsl.state;

import java.util.Optional;

/**
 * Loads the current state of a stream.
 *
 * @param <S> The type of the state
 */
@FunctionalInterface
public interface StateStore<S> {

    /**
     * @return The state of the stream, the initial state if the stream has no events, or empty if there's no state at all
     */
    Optional<S> load(String streamId);
}
