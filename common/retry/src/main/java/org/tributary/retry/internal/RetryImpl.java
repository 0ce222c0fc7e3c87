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

package org.tributary.retry.internal;

import org.jspecify.annotations.NullMarked;
import org.tributary.retry.Backoff;
import org.tributary.retry.MaxAttempts;
import org.tributary.retry.RetryInfo;
import org.tributary.retry.RetryStrategy;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

import static org.tributary.retry.MaxAttempts.Infinite.infinite;

/**
 * A retry strategy that does retry. By default, the following settings are used:
 *
 * <ul>
 *     <li>No backoff</li>
 *     <li>Infinite number of retries</li>
 *     <li>Retries all exceptions</li>
 *     <li>No listeners (will retry silently)</li>
 * </ul>
 */
@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    // @formatter:off
    private static final BiConsumer<RetryInfo, Throwable> NOOP_LISTENER = (__, ___) -> {};
    // @formatter:on

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<RetryInfo, Throwable> errorListener;
    final BiConsumer<RetryInfo, Throwable> onBeforeRetryListener;

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate,
                      BiConsumer<RetryInfo, Throwable> errorListener, BiConsumer<RetryInfo, Throwable> onBeforeRetryListener) {
        this.backoff = Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        this.maxAttempts = Objects.requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        this.retryPredicate = Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
        this.errorListener = Objects.requireNonNull(errorListener, "Error listener cannot be null");
        this.onBeforeRetryListener = Objects.requireNonNull(onBeforeRetryListener, "Before retry listener cannot be null");
    }

    public RetryImpl() {
        this(Backoff.none(), infinite(), __ -> true, NOOP_LISTENER, NOOP_LISTENER);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener, onBeforeRetryListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, infinite(), retryPredicate, errorListener, onBeforeRetryListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, new MaxAttempts.Limit(maxAttempts), retryPredicate, errorListener, onBeforeRetryListener);
    }

    @Override
    public RetryImpl retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener, onBeforeRetryListener);
    }

    @Override
    public Retry onError(BiConsumer<RetryInfo, Throwable> errorListener) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener, onBeforeRetryListener);
    }

    @Override
    public Retry onBeforeRetry(BiConsumer<RetryInfo, Throwable> onBeforeRetryListener) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener, onBeforeRetryListener);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryImpl that)) return false;
        return Objects.equals(backoff, that.backoff) && Objects.equals(maxAttempts, that.maxAttempts) && Objects.equals(retryPredicate, that.retryPredicate)
                && Objects.equals(errorListener, that.errorListener) && Objects.equals(onBeforeRetryListener, that.onBeforeRetryListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, maxAttempts, retryPredicate, errorListener, onBeforeRetryListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + maxAttempts)
                .toString();
    }
}
