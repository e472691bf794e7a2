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

/**
 * Pure function computing next state of an aggregate from previous state and an event.
 *
 * <p>Must be deterministic and free of side effects. It may throw to signal an event it cannot apply, which
 * corrupts the aggregate.</p>
 *
 * @param <S> type of state
 * @param <E> type of event payload
 */
@FunctionalInterface
public interface Fold<S, E> {
    S apply(S state, Event<E> event);
}
