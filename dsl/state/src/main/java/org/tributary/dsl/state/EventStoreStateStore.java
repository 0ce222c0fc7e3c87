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

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.EventReader;
import org.tributary.subscription.api.EventSerializer;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A {@link StateStore} that reads all events of a stream from an {@link EventReader} and folds them with a {@link State}.
 * Events that the {@link EventSerializer} doesn't know, or that are not of the event type of the state, are skipped.
 *
 * @param <S> The type of the state
 * @param <E> The type of the events that evolve the state
 */
public class EventStoreStateStore<S, E> implements StateStore<S> {
    private static final Logger log = LoggerFactory.getLogger(EventStoreStateStore.class);
    private static final byte[] NO_DATA = new byte[0];

    private final EventReader eventReader;
    private final EventSerializer serializer;
    private final Class<E> eventType;
    private final State<S, E> state;

    public EventStoreStateStore(EventReader eventReader, EventSerializer serializer, Class<E> eventType, State<S, E> state) {
        this.eventReader = requireNonNull(eventReader, EventReader.class.getSimpleName() + " cannot be null");
        this.serializer = requireNonNull(serializer, EventSerializer.class.getSimpleName() + " cannot be null");
        this.eventType = requireNonNull(eventType, "eventType cannot be null");
        this.state = requireNonNull(state, State.class.getSimpleName() + " cannot be null");
    }

    @Override
    public Optional<S> load(String streamId) {
        requireNonNull(streamId, "streamId cannot be null");
        try (Stream<CloudEvent> events = eventReader.read(streamId)) {
            return state.fold(events.map(this::deserialize)
                    .filter(Objects::nonNull)
                    .filter(eventType::isInstance)
                    .map(eventType::cast));
        }
    }

    private @Nullable Object deserialize(CloudEvent cloudEvent) {
        CloudEventData data = cloudEvent.getData();
        Object event = serializer.deserialize(data == null ? NO_DATA : data.toBytes(), cloudEvent.getType());
        if (event == null) {
            log.debug("Skipping event {} of unknown type {}", cloudEvent.getId(), cloudEvent.getType());
        }
        return event;
    }
}
