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

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;

/**
 * Serial executor with timers. All tasks submitted to single scheduler run one at a time, in order of submission,
 * so that state touched only from within the tasks needs no locking.
 */
public interface LoopScheduler extends Executor {

    /**
     * Run task after a delay.
     * @param task the task
     * @param delay delay, zero or negative delay schedules the task for immediate execution
     * @return handle to cancel the task
     */
    ScheduledAction schedule(Runnable task, Duration delay);

    /**
     * Current time as seen by this scheduler.
     * @return current instant
     */
    Instant now();
}
