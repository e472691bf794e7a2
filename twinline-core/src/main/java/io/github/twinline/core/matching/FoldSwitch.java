package io.github.twinline.core.matching;

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

import io.github.twinline.core.Event;
import io.github.twinline.core.Fold;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Typesafe matching of event payload variants for a fold. Branches are tried in order they were registered,
 * and first branch whose class matches the payload computes the next state.
 *
 * <p>There is no fallback branch. A payload no branch handles is an error, reported as
 * {@link UnhandledEventException}, so a new variant cannot silently leave the state unchanged.</p>
 *
 * <pre>
 * FoldSwitch&lt;Machine, FactoryEvent&gt; fold = FoldSwitch.builder(Machine.class, FactoryEvent.class)
 *     .on(Produced.class, (state, event) -&gt; state.withBufferQty(state.bufferQty() + event.getPayload().qty()))
 *     .on(PickedUp.class, (state, event) -&gt; state.withBufferQty(state.bufferQty() - event.getPayload().qty()))
 *     .build();
 * </pre>
 *
 * @param <S> type of state
 * @param <E> common type of payloads
 */
public class FoldSwitch<S, E> implements Fold<S, E> {
    private final List<FoldBranch<S, ? extends E>> branches;

    private FoldSwitch(Builder<S, E> b) {
        this.branches = new ArrayList<>(b.branches);
    }

    @Override
    public S apply(S state, Event<E> event) {
        for (FoldBranch<S, ? extends E> branch : branches) {
            if (branch.matches(event.getPayload())) {
                return branch.apply(state, event);
            }
        }
        throw new UnhandledEventException(event);
    }

    /**
     * Check whether any branch handles the payload.
     * @param payload payload to check
     * @return true if {@link #apply(Object, Event)} would not throw {@link UnhandledEventException}
     */
    public boolean handles(Object payload) {
        return branches.stream().anyMatch(b -> b.matches(payload));
    }

    public static <S, E> Builder<S, E> builder(Class<S> stateClass, Class<E> eventClass) {
        return new Builder<>();
    }

    public static class Builder<S, E> {
        protected List<FoldBranch<S, ? extends E>> branches = new ArrayList<>();

        public <T extends E> Builder<S, E> on(Class<T> clazz, BiFunction<S, Event<T>, S> fold) {
            this.branches.add(new FoldBranch<>(clazz, fold));
            return this;
        }

        public FoldSwitch<S, E> build() {
            if (branches.isEmpty()) {
                throw new IllegalStateException("At least one branch is required");
            }
            return new FoldSwitch<>(this);
        }
    }

    private static class FoldBranch<S, T> {
        private final Class<T> caseClass;
        private final BiFunction<S, Event<T>, S> fold;

        FoldBranch(Class<T> caseClass, BiFunction<S, Event<T>, S> fold) {
            this.caseClass = Objects.requireNonNull(caseClass, "Case class cannot be null");
            this.fold = Objects.requireNonNull(fold, "Fold cannot be null");
        }

        boolean matches(Object payload) {
            return payload != null && caseClass.isInstance(payload);
        }

        S apply(S state, Event<?> event) {
            return fold.apply(state, event.as(caseClass));
        }
    }
}
