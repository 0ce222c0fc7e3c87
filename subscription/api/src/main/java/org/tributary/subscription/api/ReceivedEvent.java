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

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A transport-agnostic representation of an event that was delivered by a persistent subscription.
 *
 * @param eventId        The unique id of the event
 * @param globalPosition The position of the event in the whole log
 * @param streamId       The stream that the event was originally appended to
 * @param streamPosition The position of the event within its stream
 * @param sequence       The sequence of the event as seen by the subscription, equal to {@code streamPosition} for persistent subscriptions
 * @param eventType      The type discriminator of the event
 * @param created        The time the store assigned to the event
 * @param data           The payload bytes
 * @param metadata       The metadata bytes, empty if the event has no metadata
 * @param retryCount     The number of times the store has redelivered this event
 */
@NullMarked
public record ReceivedEvent(String eventId, long globalPosition, String streamId, long streamPosition, long sequence,
                            String eventType, OffsetDateTime created, byte[] data, byte[] metadata, int retryCount) {

    public ReceivedEvent {
        requireNonNull(eventId, "eventId cannot be null");
        requireNonNull(streamId, "streamId cannot be null");
        requireNonNull(eventType, "eventType cannot be null");
        requireNonNull(created, "created cannot be null");
        requireNonNull(data, "data cannot be null");
        requireNonNull(metadata, "metadata cannot be null");
        if (globalPosition < 0) {
            throw new IllegalArgumentException("globalPosition cannot be negative");
        } else if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount cannot be negative");
        }
        data = data.clone();
        metadata = metadata.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public byte[] metadata() {
        return metadata.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReceivedEvent that)) return false;
        return globalPosition == that.globalPosition && streamPosition == that.streamPosition && sequence == that.sequence && retryCount == that.retryCount
                && Objects.equals(eventId, that.eventId) && Objects.equals(streamId, that.streamId) && Objects.equals(eventType, that.eventType)
                && Objects.equals(created, that.created) && Arrays.equals(data, that.data) && Arrays.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(eventId, globalPosition, streamId, streamPosition, sequence, eventType, created, retryCount);
        result = 31 * result + Arrays.hashCode(data);
        result = 31 * result + Arrays.hashCode(metadata);
        return result;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ReceivedEvent.class.getSimpleName() + "[", "]")
                .add("eventId='" + eventId + "'")
                .add("globalPosition=" + globalPosition)
                .add("streamId='" + streamId + "'")
                .add("streamPosition=" + streamPosition)
                .add("eventType='" + eventType + "'")
                .add("created=" + created)
                .add("retryCount=" + retryCount)
                .toString();
    }
}
