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

package org.tributary.serializer.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.tributary.subscription.api.EventSerializer;
import org.tributary.subscription.api.exception.SerializationException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventSerializer} that uses a Jackson {@link ObjectMapper} to serialize events to JSON (content type {@value #CONTENT_TYPE}).
 * Event types are mapped to classes explicitly, events of unregistered types are deserialized to {@code null}.
 * <p>
 * Example:
 * <pre>
 * EventSerializer serializer = new JacksonEventSerializer()
 *         .register("OrderCreated", OrderCreated.class)
 *         .register("OrderShipped", OrderShipped.class);
 * </pre>
 * </p>
 */
@NullMarked
public final class JacksonEventSerializer implements EventSerializer {
    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;
    private final Map<String, Class<?>> types;

    /**
     * Create an instance with an {@link ObjectMapper} that handles {@code java.time} types and ignores unknown properties.
     */
    public JacksonEventSerializer() {
        this(defaultObjectMapper());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this(objectMapper, Map.of());
    }

    private JacksonEventSerializer(ObjectMapper objectMapper, Map<String, Class<?>> types) {
        this.objectMapper = requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.types = types;
    }

    /**
     * @return A new serializer that also maps {@code eventType} to {@code type}
     */
    public JacksonEventSerializer register(String eventType, Class<?> type) {
        requireNonNull(eventType, "eventType cannot be null");
        requireNonNull(type, "type cannot be null");
        if (types.containsKey(eventType)) {
            throw new IllegalArgumentException("Event type " + eventType + " is already registered to " + types.get(eventType).getName());
        }
        Map<String, Class<?>> newTypes = new HashMap<>(types);
        newTypes.put(eventType, type);
        return new JacksonEventSerializer(objectMapper, Map.copyOf(newTypes));
    }

    @Override
    public @Nullable Object deserialize(byte[] data, String eventType) {
        requireNonNull(data, "data cannot be null");
        requireNonNull(eventType, "eventType cannot be null");
        Class<?> type = types.get(eventType);
        if (type == null) {
            return null;
        }
        try {
            return objectMapper.readValue(data, type);
        } catch (IOException e) {
            throw new SerializationException(eventType, e);
        }
    }

    @Override
    public SerializedEvent serialize(Object event) {
        requireNonNull(event, "event cannot be null");
        String eventType = eventTypeOf(event.getClass());
        try {
            return new SerializedEvent(eventType, objectMapper.writeValueAsBytes(event), CONTENT_TYPE);
        } catch (IOException e) {
            throw new SerializationException(eventType, e);
        }
    }

    private String eventTypeOf(Class<?> type) {
        return types.entrySet().stream()
                .filter(entry -> Objects.equals(entry.getValue(), type))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No event type is registered for " + type.getName()));
    }

    private static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
