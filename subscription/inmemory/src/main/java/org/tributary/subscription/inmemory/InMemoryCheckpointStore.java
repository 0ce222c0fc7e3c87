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

import org.tributary.subscription.api.Checkpoint;
import org.tributary.subscription.api.CheckpointStore;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CheckpointStore} that keeps the checkpoints in memory. A stored position never moves backwards.
 */
public class InMemoryCheckpointStore implements CheckpointStore {
    private final ConcurrentMap<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Checkpoint load(String subscriptionId) {
        requireNonNull(subscriptionId, "subscriptionId cannot be null");
        return checkpoints.getOrDefault(subscriptionId, Checkpoint.empty(subscriptionId));
    }

    @Override
    public Checkpoint store(Checkpoint checkpoint) {
        requireNonNull(checkpoint, Checkpoint.class.getSimpleName() + " cannot be null");
        return checkpoints.merge(checkpoint.subscriptionId(), checkpoint, (current, next) -> {
            if (current.position() == null) {
                return next;
            } else if (next.position() == null) {
                return current;
            }
            return next.position() > current.position() ? next : current;
        });
    }
}
