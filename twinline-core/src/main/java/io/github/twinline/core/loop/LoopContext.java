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

import io.github.twinline.core.dispatch.LoopScheduler;
import io.github.twinline.core.dispatch.SubscriptionDispatcher;
import io.github.twinline.core.store.EventLog;

import java.util.Objects;

/**
 * Collaborators shared by control loops of one process. Loops sharing a context share the feeds of their
 * aggregates and run on one scheduler.
 */
public class LoopContext {
    private final EventLog log;
    private final SubscriptionDispatcher dispatcher;
    private final RetryStrategy retryStrategy;

    public LoopContext(EventLog log, LoopScheduler scheduler) {
        this(log, scheduler, RetryStrategy.defaultStrategy());
    }

    public LoopContext(EventLog log, LoopScheduler scheduler, RetryStrategy retryStrategy) {
        this(log, new SubscriptionDispatcher(log, scheduler), retryStrategy);
    }

    public LoopContext(EventLog log, SubscriptionDispatcher dispatcher, RetryStrategy retryStrategy) {
        this.log = Objects.requireNonNull(log, "Event log must be specified");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy must be specified");
    }

    public EventLog getLog() {
        return log;
    }

    public SubscriptionDispatcher getDispatcher() {
        return dispatcher;
    }

    public LoopScheduler getScheduler() {
        return dispatcher.getScheduler();
    }

    public RetryStrategy getRetryStrategy() {
        return retryStrategy;
    }
}
