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

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Loop scheduler with manually advanced clock. Tasks run only on the thread calling {@link #runPending()} or
 * {@link #advance(Duration)}, which makes timing of control loops deterministic in tests and simulations.
 */
public class VirtualTimeScheduler implements LoopScheduler {
    private static final Logger logger = LoggerFactory.getLogger(VirtualTimeScheduler.class);

    private final PriorityQueue<VirtualTask> queue = new PriorityQueue<>(
            Comparator.comparing((VirtualTask t) -> t.due).thenComparingLong(t -> t.order));
    private Instant now;
    private long counter;

    public VirtualTimeScheduler() {
        this(Instant.parse("2017-01-01T00:00:00Z"));
    }

    public VirtualTimeScheduler(Instant start) {
        this.now = start;
    }

    @Override
    public void execute(Runnable command) {
        enqueue(command, Duration.ZERO);
    }

    @Override
    public ScheduledAction schedule(Runnable task, Duration delay) {
        return enqueue(task, delay.isNegative() ? Duration.ZERO : delay);
    }

    private synchronized VirtualTask enqueue(Runnable task, Duration delay) {
        VirtualTask scheduled = new VirtualTask(task, now.plus(delay), counter++);
        queue.add(scheduled);
        return scheduled;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    /**
     * Run all tasks that are due at current virtual time, including tasks they submit.
     * @return number of tasks executed
     */
    public int runPending() {
        int executed = 0;
        VirtualTask task;
        while ((task = nextDue(now())) != null) {
            task.run();
            executed++;
        }
        return executed;
    }

    /**
     * Move the clock forward, running every task that becomes due at the time it is due.
     * @param duration amount of time to advance
     * @return number of tasks executed
     */
    public int advance(Duration duration) {
        Instant target = now().plus(duration);
        int executed = runPending();
        VirtualTask task;
        while ((task = nextDue(target)) != null) {
            synchronized (this) {
                if (task.due.isAfter(now)) {
                    now = task.due;
                }
            }
            task.run();
            executed++;
            executed += runPending();
        }
        synchronized (this) {
            now = target;
        }
        return executed + runPending();
    }

    /**
     * @return number of tasks waiting, including ones that are not due yet
     */
    public synchronized int queued() {
        return (int) queue.stream().filter(t -> !t.cancelled).count();
    }

    private synchronized VirtualTask nextDue(Instant limit) {
        while (!queue.isEmpty()) {
            VirtualTask head = queue.peek();
            if (head.cancelled) {
                queue.poll();
            } else if (!head.due.isAfter(limit)) {
                return queue.poll();
            } else {
                return null;
            }
        }
        return null;
    }

    private static class VirtualTask implements ScheduledAction {
        private final Runnable task;
        private final Instant due;
        private final long order;
        private volatile boolean cancelled;
        private volatile boolean done;

        VirtualTask(Runnable task, Instant due, long order) {
            this.task = task;
            this.due = due;
            this.order = order;
        }

        void run() {
            done = true;
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Task {} failed", task, e);
            }
        }

        @Override
        public boolean cancel() {
            if (done || cancelled) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }
    }
}
