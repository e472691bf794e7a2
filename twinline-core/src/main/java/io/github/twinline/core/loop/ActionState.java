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

/**
 * Lifecycle of an action kind within a control loop. Only an {@code IDLE} action may start.
 */
public enum ActionState {
    /**
     * Waiting for its policy to be satisfied.
     */
    IDLE,
    /**
     * Started, waiting for the processing delay to elapse and its events to be appended.
     */
    RUNNING,
    /**
     * Events appended, waiting until the observed aggregates reflect them.
     */
    SETTLING,
    /**
     * Waiting for the cool-down period to pass.
     */
    COOLING_DOWN
}
