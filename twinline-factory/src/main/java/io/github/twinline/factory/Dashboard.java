package io.github.twinline.factory;

/*-
 * #%L
 * twinline-factory
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
import io.github.twinline.core.dispatch.SnapshotListener;
import io.github.twinline.core.dispatch.Subscription;
import io.github.twinline.core.dispatch.SubscriptionDispatcher;
import io.github.twinline.factory.twin.FactoryTwins;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Displays every state of the factory twins and the coin. Only reads, never emits.
 */
public class Dashboard implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Dashboard.class);

    private final SubscriptionDispatcher dispatcher;
    private final Consumer<String> display;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile Consumer<Throwable> failureHandler;

    public Dashboard(SubscriptionDispatcher dispatcher) {
        this(dispatcher, logger::info);
    }

    public Dashboard(SubscriptionDispatcher dispatcher, Consumer<String> display) {
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.display = Objects.requireNonNull(display);
    }

    public void setFailureHandler(Consumer<Throwable> failureHandler) {
        this.failureHandler = failureHandler;
    }

    public void start() {
        show(FactoryTwins.MACHINE);
        show(FactoryTwins.ROBOT);
        show(FactoryTwins.FORKLIFT);
        show(FactoryTwins.COIN);
    }

    private <S> void show(AggregateDefinition<S, ?> definition) {
        subscriptions.add(dispatcher.observe(definition, SnapshotListener.<S>of(this::display, this::failed)));
    }

    private void display(AggregateSnapshot<?> snapshot) {
        display.accept(StateRendering.json(snapshot));
    }

    private void failed(Throwable failure) {
        logger.error("Dashboard lost a twin", failure);
        Consumer<Throwable> handler = failureHandler;
        if (handler != null) {
            handler.accept(failure);
        }
    }

    @Override
    public void close() {
        subscriptions.forEach(Subscription::close);
    }
}
