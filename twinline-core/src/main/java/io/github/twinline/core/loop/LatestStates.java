package io.github.twinline.core.loop;

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

import io.github.twinline.core.AggregateDefinition;
import io.github.twinline.core.AggregateSnapshot;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Most recent snapshot of every aggregate a control loop observes. Policies and planners decide based on these.
 */
public final class LatestStates {
    private final Set<String> observed = new LinkedHashSet<>();
    private final Map<String, AggregateSnapshot<?>> snapshots = new HashMap<>();

    void expect(AggregateDefinition<?, ?> definition) {
        observed.add(definition.getKey());
    }

    void update(AggregateSnapshot<?> snapshot) {
        snapshots.put(snapshot.getKey(), snapshot);
    }

    /**
     * @return true when every observed aggregate has delivered its state
     */
    public boolean isComplete() {
        return snapshots.keySet().containsAll(observed);
    }

    /**
     * Latest state of an observed aggregate.
     * @param definition the aggregate
     * @param <S> type of state
     * @return the state
     * @throws IllegalStateException when the aggregate did not deliver a state yet, or is not observed
     */
    public <S> S get(AggregateDefinition<S, ?> definition) {
        return snapshot(definition).getValue();
    }

    public <S> AggregateSnapshot<S> snapshot(AggregateDefinition<S, ?> definition) {
        AggregateSnapshot<?> snapshot = snapshots.get(definition.getKey());
        if (snapshot == null) {
            throw new IllegalStateException("No state of " + definition.getKey() + " observed yet");
        }
        return (AggregateSnapshot<S>) snapshot;
    }

    /**
     * Sequence number the latest state of an aggregate reflects.
     * @param aggregateKey key of the aggregate
     * @return sequence number, or -1 when no state was observed yet
     */
    public long asOfSequence(String aggregateKey) {
        AggregateSnapshot<?> snapshot = snapshots.get(aggregateKey);
        return snapshot == null ? -1 : snapshot.getAsOfSequence();
    }

    public Set<String> getObserved() {
        return Collections.unmodifiableSet(observed);
    }

    @Override
    public String toString() {
        return snapshots.values().toString();
    }
}
