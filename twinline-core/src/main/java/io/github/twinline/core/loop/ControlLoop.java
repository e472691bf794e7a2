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
import io.github.twinline.core.Event;
import io.github.twinline.core.dispatch.LoopScheduler;
import io.github.twinline.core.dispatch.ScheduledAction;
import io.github.twinline.core.dispatch.SnapshotListener;
import io.github.twinline.core.dispatch.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reactive unit that observes aggregates and starts actions when their states satisfy a policy.
 *
 * <p>Subclasses declare the aggregates they {@linkplain #observe(AggregateDefinition) observe} and the
 * {@linkplain #action(String, Predicate, Function) actions} they can take. Whenever any observed aggregate
 * delivers new state, policies of all idle actions are evaluated in order of registration. An action whose
 * policy holds starts: its planner computes the events to emit, and after the plan's processing delay the events
 * are appended to the log.</p>
 *
 * <p>Every action kind runs at most once at a time. After it starts, it is not idle again until its appends
 * completed, the observed aggregates reflect the appended events, and the optional cool-down passed. Policies are
 * evaluated again when an action becomes idle, so a condition that held during the run is not missed.</p>
 *
 * <p>Failed appends are retried per {@link RetryStrategy}. An emission that cannot be appended is logged and lost,
 * the action still completes. All state of the loop is touched only from its {@link LoopScheduler}.</p>
 */
public abstract class ControlLoop implements AutoCloseable {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final LoopContext context;
    private final List<AggregateDefinition<?, ?>> observed = new ArrayList<>();
    private final LatestStates states = new LatestStates();
    private final Map<String, Action> actions = new LinkedHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Set<Timer> timers = ConcurrentHashMap.newKeySet();
    private volatile Consumer<Throwable> failureHandler;
    private volatile boolean started;
    private volatile boolean closed;

    protected ControlLoop(String name, LoopContext context) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.context = Objects.requireNonNull(context, "Context must be specified");
    }

    public String getName() {
        return name;
    }

    /**
     * Declare an aggregate the policies depend on. Policies are not evaluated until every observed aggregate
     * delivered its state.
     * @param definition the aggregate
     */
    protected void observe(AggregateDefinition<?, ?> definition) {
        checkNotStarted();
        observed.add(definition);
        states.expect(definition);
    }

    /**
     * Declare an action.
     * @param kind name of the action, unique within the loop
     * @param policy condition under which an idle action starts
     * @param planner computes the plan of started action. May return {@code null} to not start after all
     */
    protected void action(String kind, Predicate<LatestStates> policy, Function<LatestStates, ActionPlan> planner) {
        checkNotStarted();
        if (actions.putIfAbsent(kind, new Action(kind, policy, planner)) != null) {
            throw new IllegalArgumentException("Action " + kind + " is already declared in " + name);
        }
    }

    private void checkNotStarted() {
        if (started) {
            throw new IllegalStateException("Control loop " + name + " is already started");
        }
    }

    /**
     * Handler invoked when the loop stops due to a failure of an observed aggregate.
     * @param failureHandler the handler
     */
    public void setFailureHandler(Consumer<Throwable> failureHandler) {
        this.failureHandler = failureHandler;
    }

    /**
     * Subscribe to observed aggregates.
     */
    public void start() {
        checkNotStarted();
        if (observed.isEmpty() || actions.isEmpty()) {
            throw new IllegalStateException("Control loop " + name + " needs observed aggregates and actions");
        }
        started = true;
        for (AggregateDefinition<?, ?> definition : observed) {
            subscriptions.add(subscribe(definition));
        }
        logger.info("{} started, observing {}", name, states.getObserved());
    }

    private <S> Subscription subscribe(AggregateDefinition<S, ?> definition) {
        return context.getDispatcher().observe(definition, SnapshotListener.<S>of(this::onSnapshot, this::onFailure));
    }

    /**
     * Current state of an action.
     * @param kind the action
     * @return the state
     */
    public ActionState stateOf(String kind) {
        Action action = actions.get(kind);
        if (action == null) {
            throw new IllegalArgumentException("Unknown action " + kind + " of " + name);
        }
        return action.state;
    }

    /**
     * @return number of delays, retries and cool-downs that did not elapse yet
     */
    public int pendingTimers() {
        return timers.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stop observing and cancel all pending timers. An action that is running will not emit its events.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        subscriptions.forEach(Subscription::close);
        for (Timer timer : new ArrayList<>(timers)) {
            timer.cancel();
        }
        logger.info("{} closed", name);
    }

    private void onSnapshot(AggregateSnapshot<?> snapshot) {
        if (closed) {
            return;
        }
        states.update(snapshot);
        logger.debug("{} observes {}", name, snapshot);
        for (Action action : actions.values()) {
            action.checkSettled();
        }
        evaluate();
    }

    private void onFailure(Throwable failure) {
        if (closed) {
            return;
        }
        logger.error("{} stops, because observed aggregate failed", name, failure);
        close();
        Consumer<Throwable> handler = failureHandler;
        if (handler != null) {
            handler.accept(failure);
        }
    }

    private void evaluate() {
        if (closed || !states.isComplete()) {
            return;
        }
        for (Action action : actions.values()) {
            if (action.state == ActionState.IDLE && action.policy.test(states)) {
                action.start();
            }
        }
    }

    private void schedule(Runnable task, Duration delay) {
        Timer timer = new Timer(task);
        timers.add(timer);
        timer.scheduled = context.getScheduler().schedule(timer, delay);
    }

    static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    class Action {
        private final String kind;
        private final Predicate<LatestStates> policy;
        private final Function<LatestStates, ActionPlan> planner;
        private final Map<String, Long> awaited = new HashMap<>();
        private ActionState state = ActionState.IDLE;
        private ActionPlan plan;
        private int pendingAppends;

        Action(String kind, Predicate<LatestStates> policy, Function<LatestStates, ActionPlan> planner) {
            this.kind = Objects.requireNonNull(kind);
            this.policy = Objects.requireNonNull(policy);
            this.planner = Objects.requireNonNull(planner);
        }

        void start() {
            ActionPlan planned = planner.apply(states);
            if (planned == null) {
                logger.debug("{} declined to start {}", name, kind);
                return;
            }
            plan = planned;
            transition(ActionState.RUNNING);
            if (plan.getStartMessage() != null) {
                logger.info("{} starts {}: {}", name, kind, plan.getStartMessage());
            } else {
                logger.info("{} starts {}", name, kind);
            }
            schedule(this::emit, plan.getDelay());
        }

        void emit() {
            if (plan.getEmitMessage() != null) {
                logger.info("{} emits {}: {}", name, kind, plan.getEmitMessage());
            }
            pendingAppends = plan.getEmissions().size();
            for (Emission emission : plan.getEmissions()) {
                append(emission, 0);
            }
        }

        void append(Emission emission, int completedAttempts) {
            LoopScheduler scheduler = context.getScheduler();
            context.getLog().append(emission.getTag(), emission.getPayload()).whenComplete((event, t) ->
                    scheduler.execute(() -> appended(emission, completedAttempts + 1, event, t)));
        }

        void appended(Emission emission, int attempts, Event<Object> event, Throwable t) {
            if (closed) {
                return;
            }
            if (t == null) {
                logger.debug("{} action {} appended {}", name, kind, event);
                for (AggregateDefinition<?, ?> definition : observed) {
                    if (definition.accepts(event)) {
                        awaited.merge(definition.getKey(), event.getSequenceNo(), Math::max);
                    }
                }
                emissionDone();
                return;
            }
            Throwable failure = unwrapCompletionException(t);
            long delay = context.getRetryStrategy().retryDelay(emission, failure, attempts);
            if (delay < 0) {
                logger.error("{} action {} lost emission {} after {} attempts", name, kind, emission, attempts, failure);
                emissionDone();
            } else {
                logger.warn("{} action {} failed to append {}, retrying in {} ms", name, kind, emission, delay,
                        failure);
                schedule(() -> append(emission, attempts), Duration.ofMillis(delay));
            }
        }

        void emissionDone() {
            if (--pendingAppends == 0) {
                transition(ActionState.SETTLING);
                checkSettled();
            }
        }

        /**
         * Leave SETTLING once the observed aggregates reflect all successfully appended events.
         */
        void checkSettled() {
            if (state != ActionState.SETTLING) {
                return;
            }
            awaited.entrySet().removeIf(e -> states.asOfSequence(e.getKey()) >= e.getValue());
            if (!awaited.isEmpty()) {
                return;
            }
            logger.info("{} finished {}", name, kind);
            if (plan.getCoolDown().isZero()) {
                idle();
            } else {
                transition(ActionState.COOLING_DOWN);
                schedule(this::idle, plan.getCoolDown());
            }
        }

        void idle() {
            plan = null;
            transition(ActionState.IDLE);
            evaluate();
        }

        private void transition(ActionState next) {
            logger.debug("{} action {} {} -> {}", name, kind, state, next);
            state = next;
        }
    }

    class Timer implements Runnable {
        private final Runnable task;
        private volatile ScheduledAction scheduled;

        Timer(Runnable task) {
            this.task = task;
        }

        @Override
        public void run() {
            timers.remove(this);
            if (!closed) {
                task.run();
            }
        }

        void cancel() {
            timers.remove(this);
            ScheduledAction current = scheduled;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
