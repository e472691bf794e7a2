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

/**
 * Cancellation handle of a task scheduled by {@link LoopScheduler}.
 */
public interface ScheduledAction {

    /**
     * Prevent the task from running.
     * @return true if the task was cancelled, false if it already ran or was cancelled before
     */
    boolean cancel();

    /**
     * @return true when the task already ran or was cancelled
     */
    boolean isDone();
}
