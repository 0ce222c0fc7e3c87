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

package org.tributary.subscription;

import org.tributary.subscription.api.Checkpoint;
import org.tributary.subscription.api.CheckpointStore;

/**
 * A {@link CheckpointStore} that doesn't store anything. Persistent subscriptions keep their position in the store.
 */
public class NoOpCheckpointStore implements CheckpointStore {

    @Override
    public Checkpoint load(String subscriptionId) {
        return Checkpoint.empty(subscriptionId);
    }

    @Override
    public Checkpoint store(Checkpoint checkpoint) {
        return checkpoint;
    }
}
