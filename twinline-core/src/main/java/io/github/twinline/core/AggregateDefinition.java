package io.github.twinline.core;

/*-
 * #%L
 * twinline-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;

/**
 * Describes how to derive state of an aggregate from the event log.
 *
 * <p>An aggregate is identified by its id and version. Versions denote incompatible state shapes, so two
 * definitions that differ only in version never share materialized state.</p>
 *
 * @param <S> type of state
 * @param <E> common type of event payloads the aggregate folds
 */
public final class AggregateDefinition<S, E> {
    private final String id;
    private final int version;
    private final TagFilter tagFilter;
    private final Class<E> eventType;
    private final S initialState;
    private final Fold<S, E> fold;

    private AggregateDefinition(String id, int version, TagFilter tagFilter, Class<E> eventType, S initialState,
            Fold<S, E> fold) {
        this.id = Objects.requireNonNull(id, "Id must be specified");
        this.version = version;
        this.tagFilter = Objects.requireNonNull(tagFilter, "Tag filter must be specified");
        this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
        this.initialState = Objects.requireNonNull(initialState, "Initial state must be specified");
        this.fold = Objects.requireNonNull(fold, "Fold must be specified");
        if (id.isEmpty() || id.contains("@")) {
            throw new IllegalArgumentException("Invalid aggregate id '" + id + "'");
        }
    }

    public static <S, E> AggregateDefinition<S, E> of(String id, int version, TagFilter tagFilter,
            Class<E> eventType, S initialState, Fold<S, E> fold) {
        return new AggregateDefinition<>(id, version, tagFilter, eventType, initialState, fold);
    }

    public String getId() {
        return id;
    }

    public int getVersion() {
        return version;
    }

    /**
     * Identity of the aggregate.
     * @return {@code id@version}
     */
    public String getKey() {
        return id + "@" + version;
    }

    public TagFilter getTagFilter() {
        return tagFilter;
    }

    public Class<E> getEventType() {
        return eventType;
    }

    public S getInitialState() {
        return initialState;
    }

    public Fold<S, E> getFold() {
        return fold;
    }

    public boolean accepts(Event<?> event) {
        return tagFilter.accepts(event);
    }

    @Override
    public String toString() {
        return "Aggregate " + getKey() + " of " + tagFilter;
    }
}
