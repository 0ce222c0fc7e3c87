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

package org.tributary.subscription.api;

import io.cloudevents.CloudEvent;

import java.util.stream.Stream;

/**
 * Reads the events of one stream from the store, oldest first.
 */
@FunctionalInterface
public interface EventReader {

    /**
     * @return The events of the stream, or an empty stream if it doesn't exist
     */
    Stream<CloudEvent> read(String streamId);
}
