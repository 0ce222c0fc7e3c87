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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("state")
@DisplayNameGeneration(ReplaceUnderscores.class)
class StateTest {

    @Test
    void first_event_creates_a_state_without_initial_state() {
        // Given
        CopyOnWriteArrayList<String> created = new CopyOnWriteArrayList<>();
        State<String, String> state = State.createdBy(event -> {
            created.add(event);
            return event;
        }, (current, event) -> current + "," + event);

        // When
        String folded = state.fold(Stream.of("a", "b", "c")).orElseThrow();

        // Then
        assertThat(folded).isEqualTo("a,b,c");
        assertThat(created).containsExactly("a");
    }

    @Test
    void state_without_initial_state_and_without_events_is_empty() {
        State<String, String> state = State.createdBy(event -> event, (current, event) -> current + event);

        assertThat(state.fold(Stream.empty())).isEmpty();
    }

    @Test
    void initial_state_is_returned_when_there_are_no_events() {
        State<Integer, Integer> sum = State.create(10, Integer::sum);

        assertThat(sum.fold(Stream.empty())).hasValue(10);
    }

    @Test
    void state_evolved_to_null_is_empty() {
        // Given
        State<String, String> lastUnlessDeleted = State.create("initial", (current, event) -> "deleted".equals(event) ? null : event);

        // When
        Optional<String> folded = lastUnlessDeleted.fold(Stream.of("created", "deleted"));

        // Then
        assertThat(folded).isEmpty();
    }
}
