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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.cloudevents.TributaryExtensionGetter;
import org.tributary.subscription.api.EventPosition;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("in-memory event log")
@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventLogTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private final InMemoryEventLog eventLog = new InMemoryEventLog(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void appended_events_get_stream_version_global_position_and_time() {
        // When
        eventLog.append("orders-1", event("OrderCreated"));
        eventLog.append("orders-2", event("OrderCreated"));
        List<CloudEvent> stored = eventLog.append("orders-1", event("OrderShipped"));

        // Then
        CloudEvent shipped = stored.get(0);
        assertAll(
                () -> assertThat(TributaryExtensionGetter.getStreamId(shipped)).isEqualTo("orders-1"),
                () -> assertThat(TributaryExtensionGetter.getStreamVersion(shipped)).isEqualTo(1L),
                () -> assertThat(TributaryExtensionGetter.getGlobalPosition(shipped)).isEqualTo(2L),
                () -> assertThat(shipped.getTime()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)),
                () -> assertThat(eventLog.nextPosition()).isEqualTo(3L)
        );
    }

    @Test
    void reads_only_the_events_of_the_given_stream() {
        // Given
        eventLog.append("orders-1", event("OrderCreated"), event("OrderShipped"));
        eventLog.append("orders-2", event("OrderCreated"));

        // When
        List<CloudEvent> events = eventLog.read("orders-1").toList();

        // Then
        assertThat(events).extracting(CloudEvent::getType).containsExactly("OrderCreated", "OrderShipped");
    }

    @Test
    void last_event_position_is_null_when_log_is_empty() {
        assertThat(eventLog.readLastEventPosition()).isNull();
    }

    @Test
    void last_event_position_is_the_position_of_the_last_appended_event() {
        // Given
        eventLog.append("orders-1", event("OrderCreated"), event("OrderShipped"));

        // When
        EventPosition position = eventLog.readLastEventPosition();

        // Then
        assertThat(position).isEqualTo(new EventPosition(1, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)));
    }

    private static CloudEvent event(String type) {
        return CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(URI.create("urn:tributary:test"))
                .withType(type)
                .build();
    }
}
