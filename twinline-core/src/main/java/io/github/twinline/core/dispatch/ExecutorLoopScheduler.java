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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Loop scheduler running its tasks on single dedicated thread.
 */
public class ExecutorLoopScheduler implements LoopScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorLoopScheduler.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;

    public ExecutorLoopScheduler(String threadName) {
        this(threadName, Clock.systemUTC());
    }

    public ExecutorLoopScheduler(String threadName, Clock clock) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
        this.clock = clock;
    }

    @Override
    public void execute(Runnable command) {
        executor.execute(guarded(command));
    }

    @Override
    public ScheduledAction schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), Math.max(0, delay.toMillis()),
                TimeUnit.MILLISECONDS);
        return new ScheduledAction() {
            @Override
            public boolean cancel() {
                return future.cancel(false);
            }

            @Override
            public boolean isDone() {
                return future.isDone();
            }
        };
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    /**
     * Stop accepting tasks, and wait for running task to finish.
     * @param timeout maximum time to wait
     * @return true if the scheduler terminated within the timeout
     * @throws InterruptedException when interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        executor.shutdownNow();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // an exception escaping a scheduled task would otherwise vanish in its future
                logger.error("Task {} failed", task, e);
            }
        };
    }
}
