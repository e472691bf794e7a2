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

import io.github.twinline.core.dispatch.ExecutorLoopScheduler;
import io.github.twinline.core.loop.ControlLoop;
import io.github.twinline.core.loop.LoopContext;
import io.github.twinline.core.store.EventLog;
import io.github.twinline.core.store.inmemory.InMemoryEventLog;
import io.github.twinline.core.store.jdbc.DefaultJdbcSchema;
import io.github.twinline.core.store.jdbc.JdbcEventLog;
import io.github.twinline.factory.event.FactoryTags;
import io.github.twinline.factory.loop.CoinTossLoop;
import io.github.twinline.factory.loop.ForkliftLoop;
import io.github.twinline.factory.loop.MachineLoop;
import io.github.twinline.factory.loop.RobotLoop;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the event log, the scheduler and the selected programs of one process.
 */
public class FactoryRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FactoryRuntime.class);

    public enum Program {
        MACHINE, ROBOT, FORKLIFT, DASHBOARD, COINTOSS, ALL;

        public String argument() {
            return name().toLowerCase();
        }

        /**
         * @param argument program name as given on command line
         * @return the program, or null when there's none with such name
         */
        public static Program of(String argument) {
            for (Program program : values()) {
                if (program.argument().equals(argument)) {
                    return program;
                }
            }
            return null;
        }
    }

    private final FactoryConfiguration config;
    private final ExecutorLoopScheduler scheduler;
    private final ScheduledExecutorService logExecutor;
    private final EventLog log;
    private final LoopContext context;
    private final List<ControlLoop> loops = new ArrayList<>();
    private final CompletableFuture<Throwable> failure = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private Dashboard dashboard;

    public FactoryRuntime(FactoryConfiguration config) {
        this.config = config;
        this.scheduler = new ExecutorLoopScheduler("twinline-loop");
        this.logExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "twinline-log");
            thread.setDaemon(true);
            return thread;
        });
        this.log = openLog(config, logExecutor);
        this.context = new LoopContext(log, scheduler, config.retryStrategy());
    }

    static EventLog openLog(FactoryConfiguration config, ScheduledExecutorService executor) {
        if (config.isMemoryLog()) {
            logger.info("Using event log in memory of this process");
            return new InMemoryEventLog();
        }
        String url = config.logUrl();
        if (!url.startsWith("jdbc:h2:")) {
            throw new IllegalArgumentException("Unsupported twinline.log.url " + url
                    + ", expected 'memory' or an H2 JDBC URL");
        }
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL(url);
        ds.setUser(config.logUser());
        ds.setPassword(config.logPassword());
        DefaultJdbcSchema schema = new DefaultJdbcSchema();
        createTable(ds, schema);
        logger.info("Using event log at {}", url);
        return new JdbcEventLog(ds, schema, FactoryTags.serialization(), config.strictLog(), executor,
                config.pollInterval());
    }

    private static void createTable(DataSource ds, DefaultJdbcSchema schema) {
        try (Connection connection = ds.getConnection()) {
            schema.createTable(connection);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot prepare event log table", e);
        }
    }

    public EventLog getLog() {
        return log;
    }

    public List<ControlLoop> getLoops() {
        return loops;
    }

    /**
     * Start the program.
     * @param program program to start
     */
    public void start(Program program) {
        switch (program) {
            case MACHINE:
                loops.add(new MachineLoop(context, config));
                break;
            case ROBOT:
                loops.add(new RobotLoop(context, config));
                break;
            case FORKLIFT:
                loops.add(new ForkliftLoop(context, config));
                break;
            case COINTOSS:
                loops.add(new CoinTossLoop(context, config));
                break;
            case DASHBOARD:
                startDashboard();
                break;
            case ALL:
                loops.add(new MachineLoop(context, config));
                loops.add(new RobotLoop(context, config));
                loops.add(new ForkliftLoop(context, config));
                loops.add(new CoinTossLoop(context, config));
                startDashboard();
                break;
            default:
                throw new IllegalArgumentException("Unknown program " + program);
        }
        for (ControlLoop loop : loops) {
            loop.setFailureHandler(failure::complete);
            loop.start();
        }
    }

    private void startDashboard() {
        dashboard = new Dashboard(context.getDispatcher());
        dashboard.setFailureHandler(failure::complete);
        dashboard.start();
    }

    /**
     * Wait until the programs fail. They never stop otherwise.
     * @return the failure
     * @throws InterruptedException when interrupted while waiting
     */
    public Throwable awaitFailure() throws InterruptedException {
        try {
            return failure.get();
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        loops.forEach(ControlLoop::close);
        if (dashboard != null) {
            dashboard.close();
        }
        context.getDispatcher().close();
        log.close();
        try {
            if (!scheduler.shutdown(Duration.ofSeconds(5))) {
                logger.warn("Loop scheduler did not terminate in time");
            }
            logExecutor.shutdown();
            if (!logExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Event log executor did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
