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

import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Folds the events of a stream into a state.
 * <p>
 * A state that only exists once its first event has happened, such as an order that is created by {@code OrderPlaced}, has
 * {@code null} as {@link #initialState() initial state}. {@link #evolve(Object, Object)} then receives {@code null} together
 * with the first event of the stream, and {@link #fold(Stream)} returns an empty {@link Optional} for a stream without events.
 * Use {@link #createdBy(Function, BiFunction)} to keep the creation apart from the evolution of an existing state.
 * </p>
 *
 * @param <S> The type of the state
 * @param <E> The type of the events that evolve the state
 */
public interface State<S, E> {
    /**
     * @return The state before any event has been applied, {@code null} if there's no state until the first event
     */
    @Nullable
    S initialState();

    /**
     * Evolve state by applying the event
     *
     * @param state The current state, {@code null} for the first event of a state without initial state
     * @param event The event
     * @return The evolved state
     */
    @Nullable
    S evolve(@Nullable S state, E event);

    /**
     * Evolve the initial state from events, in order.
     *
     * @return The folded state, empty if there's neither an initial state nor a state created by the events
     */
    default Optional<S> fold(Stream<? extends E> events) {
        requireNonNull(events, "events cannot be null");
        @Nullable S folded = events.sequential().reduce(initialState(), this::evolve, (left, right) -> right);
        return Optional.ofNullable(folded);
    }

    static <S, E> State<S, E> create(@Nullable S initialState, BiFunction<@Nullable S, E, @Nullable S> evolve) {
        requireNonNull(evolve, "evolve cannot be null");
        return new State<>() {
            @Override
            public @Nullable S initialState() {
                return initialState;
            }

            @Override
            public @Nullable S evolve(@Nullable S state, E event) {
                return evolve.apply(state, event);
            }
        };
    }

    /**
     * Create a state without initial state. The first event of the stream creates the state and the following events evolve it.
     *
     * @param creation Creates the state from the first event
     * @param evolve   Evolves an existing state
     */
    static <S, E> State<S, E> createdBy(Function<E, S> creation, BiFunction<S, E, S> evolve) {
        requireNonNull(creation, "creation cannot be null");
        requireNonNull(evolve, "evolve cannot be null");
        return create(null, (state, event) -> state == null ? creation.apply(event) : evolve.apply(state, event));
    }
}
