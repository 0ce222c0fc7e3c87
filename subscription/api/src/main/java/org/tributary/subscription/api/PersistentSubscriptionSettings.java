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

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Settings used when creating the server side cursor of a persistent subscription. By default:
 * <ul>
 *     <li>Link events are resolved</li>
 *     <li>The subscription starts from the beginning of the log</li>
 *     <li>An event is redelivered at most {@value #DEFAULT_MAX_RETRY_COUNT} times before the store parks it</li>
 * </ul>
 */
@NullMarked
public final class PersistentSubscriptionSettings {
    public static final int DEFAULT_MAX_RETRY_COUNT = 10;

    private final boolean resolveLinkTos;
    private final StartPosition startFrom;
    private final int maxRetryCount;

    public PersistentSubscriptionSettings() {
        this(true, StartPosition.start(), DEFAULT_MAX_RETRY_COUNT);
    }

    private PersistentSubscriptionSettings(boolean resolveLinkTos, StartPosition startFrom, int maxRetryCount) {
        requireNonNull(startFrom, StartPosition.class.getSimpleName() + " cannot be null");
        if (maxRetryCount < 0) {
            throw new IllegalArgumentException("maxRetryCount cannot be negative");
        }
        this.resolveLinkTos = resolveLinkTos;
        this.startFrom = startFrom;
        this.maxRetryCount = maxRetryCount;
    }

    public PersistentSubscriptionSettings resolveLinkTos(boolean resolveLinkTos) {
        return new PersistentSubscriptionSettings(resolveLinkTos, startFrom, maxRetryCount);
    }

    public PersistentSubscriptionSettings startFrom(StartPosition startFrom) {
        return new PersistentSubscriptionSettings(resolveLinkTos, startFrom, maxRetryCount);
    }

    public PersistentSubscriptionSettings maxRetryCount(int maxRetryCount) {
        return new PersistentSubscriptionSettings(resolveLinkTos, startFrom, maxRetryCount);
    }

    public boolean isResolveLinkTos() {
        return resolveLinkTos;
    }

    public StartPosition getStartFrom() {
        return startFrom;
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistentSubscriptionSettings that)) return false;
        return resolveLinkTos == that.resolveLinkTos && maxRetryCount == that.maxRetryCount && Objects.equals(startFrom, that.startFrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resolveLinkTos, startFrom, maxRetryCount);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", PersistentSubscriptionSettings.class.getSimpleName() + "[", "]")
                .add("resolveLinkTos=" + resolveLinkTos)
                .add("startFrom=" + startFrom)
                .add("maxRetryCount=" + maxRetryCount)
                .toString();
    }
}
