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
 * State of an aggregate after applying all accepted events up to {@code asOfSequence}.
 *
 * @param <S> type of state
 */
public final class AggregateSnapshot<S> {
    private final String aggregateId;
    private final int version;
    private final S value;
    private final long asOfSequence;

    public AggregateSnapshot(String aggregateId, int version, S value, long asOfSequence) {
        this.aggregateId = Objects.requireNonNull(aggregateId);
        this.version = version;
        this.value = Objects.requireNonNull(value, "State must not be null");
        this.asOfSequence = asOfSequence;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public int getVersion() {
        return version;
    }

    public String getKey() {
        return aggregateId + "@" + version;
    }

    public S getValue() {
        return value;
    }

    /**
     * Sequence number of last event applied to this state.
     * @return sequence number, 0 for initial state
     */
    public long getAsOfSequence() {
        return asOfSequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggregateSnapshot<?> that = (AggregateSnapshot<?>) o;
        return version == that.version && asOfSequence == that.asOfSequence
                && aggregateId.equals(that.aggregateId) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version, value, asOfSequence);
    }

    @Override
    public String toString() {
        return getKey() + "#" + asOfSequence + " " + value;
    }
}
