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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.subscription.api.Checkpoint;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("in-memory checkpoint store")
@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore checkpointStore = new InMemoryCheckpointStore();

    @Test
    void loading_an_unknown_subscription_returns_an_empty_checkpoint() {
        assertThat(checkpointStore.load("sub-A").isEmpty()).isTrue();
    }

    @Test
    void stored_position_never_moves_backwards() {
        // Given
        checkpointStore.store(new Checkpoint("sub-A", 5L));

        // When
        Checkpoint stored = checkpointStore.store(new Checkpoint("sub-A", 3L));

        // Then
        assertThat(stored).isEqualTo(new Checkpoint("sub-A", 5L));
        assertThat(checkpointStore.load("sub-A")).isEqualTo(new Checkpoint("sub-A", 5L));
    }
}
