package io.github.twinline.core.dispatch;

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

import io.github.twinline.core.AggregateSnapshot;

import java.util.function.Consumer;

/**
 * Receiver of snapshots of an observed aggregate.
 *
 * @param <S> type of state
 */
public interface SnapshotListener<S> {

    /**
     * New state of the aggregate. First invocation carries the state at the time of registration, every further
     * one a state with greater {@code asOfSequence}.
     * @param snapshot the snapshot
     */
    void onSnapshot(AggregateSnapshot<S> snapshot);

    /**
     * The aggregate will deliver no more snapshots. Invoked at most once.
     * @param failure the cause, usually {@link io.github.twinline.core.AggregateCorruptedException}
     */
    void onFailure(Throwable failure);

    static <S> SnapshotListener<S> of(Consumer<AggregateSnapshot<S>> onSnapshot, Consumer<Throwable> onFailure) {
        return new SnapshotListener<S>() {
            @Override
            public void onSnapshot(AggregateSnapshot<S> snapshot) {
                onSnapshot.accept(snapshot);
            }

            @Override
            public void onFailure(Throwable failure) {
                onFailure.accept(failure);
            }
        };
    }
}
