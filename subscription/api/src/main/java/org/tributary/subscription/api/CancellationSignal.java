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

/**
 * A signal that is cancelled when the lifetime it belongs to ends, for example when a subscription is stopped.
 */
public interface CancellationSignal {

    boolean isCancelled();

    /**
     * Register a callback that is invoked once the signal is cancelled. If the signal is already cancelled the callback is invoked immediately.
     */
    void onCancel(Runnable callback);

    /**
     * @return A signal that is never cancelled
     */
    static CancellationSignal never() {
        return new CancellationSignal() {
            @Override
            public boolean isCancelled() {
                return false;
            }

            @Override
            public void onCancel(Runnable callback) {
            }

            @Override
            public String toString() {
                return "never";
            }
        };
    }
}
