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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.tributary.subscription.api.exception.SerializationException;

import static java.util.Objects.requireNonNull;

/**
 * Converts event payloads between bytes and objects.
 */
@NullMarked
public interface EventSerializer {

    /**
     * @return The deserialized payload or {@code null} if the event type is unknown to this serializer
     * @throws SerializationException If the type is known but the payload cannot be parsed
     */
    @Nullable
    Object deserialize(byte[] data, String eventType);

    SerializedEvent serialize(Object event);

    record SerializedEvent(String eventType, byte[] data, String contentType) {
        public SerializedEvent {
            requireNonNull(eventType, "eventType cannot be null");
            requireNonNull(data, "data cannot be null");
            requireNonNull(contentType, "contentType cannot be null");
        }
    }
}
