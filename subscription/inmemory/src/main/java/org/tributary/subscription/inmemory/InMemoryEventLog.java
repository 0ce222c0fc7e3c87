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

package org.tributary.subscription.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.tributary.cloudevents.TributaryExtensionGetter;
import org.tributary.subscription.api.EventPosition;
import org.tributary.subscription.api.EventReader;
import org.tributary.subscription.api.LogTipReader;
import org.tributary.subscription.api.StartPosition;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.tributary.cloudevents.TributaryCloudEventExtension.tributary;

/**
 * An append-only, globally ordered, in-memory event log. Appended cloud events get the stream id, stream version and global position
 * as {@link org.tributary.cloudevents.TributaryCloudEventExtension} extensions, and a time if they don't have one.
 */
@NullMarked
public class InMemoryEventLog implements LogTipReader, EventReader {

    private final Clock clock;
    // Guarded by this
    private final List<CloudEvent> events = new ArrayList<>();
    private final Map<String, Long> streamVersions = new HashMap<>();
    private final List<Consumer<CloudEvent>> appendListeners = new ArrayList<>();

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    public InMemoryEventLog(Clock clock) {
        this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    public List<CloudEvent> append(String streamId, CloudEvent... events) {
        return append(streamId, Arrays.asList(events));
    }

    /**
     * Append events to a stream.
     *
     * @return The stored events, with log coordinates
     */
    public synchronized List<CloudEvent> append(String streamId, List<CloudEvent> eventsToAppend) {
        requireNonNull(streamId, "streamId cannot be null");
        requireNonNull(eventsToAppend, "events cannot be null");
        List<CloudEvent> stored = new ArrayList<>(eventsToAppend.size());
        for (CloudEvent event : eventsToAppend) {
            long streamVersion = streamVersions.merge(streamId, 0L, (current, __) -> current + 1);
            OffsetDateTime time = event.getTime() == null ? OffsetDateTime.now(clock) : event.getTime();
            CloudEvent storedEvent = CloudEventBuilder.v1(event)
                    .withTime(time)
                    .withExtension(tributary(streamId, streamVersion, events.size()))
                    .build();
            events.add(storedEvent);
            stored.add(storedEvent);
            appendListeners.forEach(listener -> listener.accept(storedEvent));
        }
        return Collections.unmodifiableList(stored);
    }

    @Override
    public synchronized @Nullable EventPosition readLastEventPosition() {
        if (events.isEmpty()) {
            return null;
        }
        CloudEvent last = events.get(events.size() - 1);
        return new EventPosition(TributaryExtensionGetter.getGlobalPosition(last), requireNonNull(last.getTime()));
    }

    @Override
    public synchronized Stream<CloudEvent> read(String streamId) {
        requireNonNull(streamId, "streamId cannot be null");
        return events.stream()
                .filter(event -> streamId.equals(TributaryExtensionGetter.getStreamId(event)))
                .toList()
                .stream();
    }

    public synchronized Stream<CloudEvent> readAll() {
        return List.copyOf(events).stream();
    }

    /**
     * @return The global position the next appended event will get
     */
    public synchronized long nextPosition() {
        return events.size();
    }

    /**
     * Replay the events from the given start position to the consumer and then keep feeding it with appended events.
     *
     * @return Stops feeding the consumer when run
     */
    synchronized Runnable subscribe(StartPosition startPosition, Consumer<CloudEvent> consumer) {
        requireNonNull(startPosition, StartPosition.class.getSimpleName() + " cannot be null");
        requireNonNull(consumer, "consumer cannot be null");
        final long from;
        if (startPosition instanceof StartPosition.At at) {
            from = at.position();
        } else if (startPosition instanceof StartPosition.End) {
            from = events.size();
        } else {
            from = 0;
        }
        for (long position = from; position < events.size(); position++) {
            consumer.accept(events.get((int) position));
        }
        appendListeners.add(consumer);
        return () -> {
            synchronized (InMemoryEventLog.this) {
                appendListeners.remove(consumer);
            }
        };
    }
}
