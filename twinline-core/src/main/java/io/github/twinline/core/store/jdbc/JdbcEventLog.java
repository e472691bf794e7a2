package io.github.twinline.core.store.jdbc;

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

import io.github.twinline.core.Event;
import io.github.twinline.core.TagFilter;
import io.github.twinline.core.store.EventLog;
import io.github.twinline.core.store.EventLogException;
import io.github.twinline.core.store.PayloadSerialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event log backed by a relational database, that can be shared by multiple processes.
 *
 * <p>Appends are executed on provided executor. Subscriptions poll the table on the same executor in fixed
 * interval, therefore events appended by other processes arrive with a delay of at most one poll interval.</p>
 *
 * <p>Sequence numbers are assigned on insert, but concurrent writers may commit them out of order. Readers
 * therefore stop before a missing sequence number and wait for it to commit. A number stays missing only when
 * its insert was rolled back, so once the event following it is older than the gap timeout, the number is
 * skipped.</p>
 */
public class JdbcEventLog implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);
    static final int BATCH_SIZE = 500;
    public static final Duration DEFAULT_GAP_TIMEOUT = Duration.ofSeconds(5);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final PayloadSerialization serialization;
    private final boolean strict;
    private final ScheduledExecutorService executor;
    private final Duration pollInterval;
    private final Duration gapTimeout;
    private final Clock clock;
    private final List<PollingSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    /**
     * Create instance that will read from provided datasource, delegating queries to JdbcSchema, deserializing events
     * by serialization, while being or not being strict.
     *
     * <p>When event log is in strict mode, an event that cannot be deserialized ends the subscription that read it
     * with a failure. This can usually happen in two cases: Either there was an error in payload serialization, or an
     * event belongs to a newer version of the system, that wrote an event currently running code doesn't yet know.
     * <p>When {@code strict} is false, such event is logged and skipped.
     *
     * @param ds the datasource
     * @param schema queries to use
     * @param serialization payload serialization
     * @param strict whether unreadable events are a failure
     * @param executor executor for appends and polling, owned by the caller
     * @param pollInterval delay between polls of every subscription
     */
    public JdbcEventLog(DataSource ds, JdbcSchema schema, PayloadSerialization serialization, boolean strict,
            ScheduledExecutorService executor, Duration pollInterval) {
        this(ds, schema, serialization, strict, executor, pollInterval, DEFAULT_GAP_TIMEOUT, Clock.systemUTC());
    }

    public JdbcEventLog(DataSource ds, JdbcSchema schema, PayloadSerialization serialization, boolean strict,
            ScheduledExecutorService executor, Duration pollInterval, Duration gapTimeout, Clock clock) {
        this.ds = Objects.requireNonNull(ds);
        this.schema = Objects.requireNonNull(schema);
        this.serialization = Objects.requireNonNull(serialization);
        this.strict = strict;
        this.executor = Objects.requireNonNull(executor);
        this.pollInterval = Objects.requireNonNull(pollInterval);
        this.gapTimeout = Objects.requireNonNull(gapTimeout);
        this.clock = Objects.requireNonNull(clock);
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (gapTimeout.isNegative()) {
            throw new IllegalArgumentException("Gap timeout must not be negative");
        }
    }

    /**
     * Indicate whether failure to deserialize event ends the reading with an exception.
     * @return true if in strict mode
     */
    public boolean isStrict() {
        return strict;
    }

    @Override
    public CompletableFuture<Event<Object>> append(String tag, Object payload) {
        Objects.requireNonNull(tag, "Tag must be specified");
        Objects.requireNonNull(payload, "Payload must be specified");
        CompletableFuture<Event<Object>> result = new CompletableFuture<>();
        if (closed) {
            result.completeExceptionally(EventLogException.closed());
            return result;
        }
        if (!serialization.supports(payload)) {
            result.completeExceptionally(EventLogException.unsupported(payload));
            return result;
        }
        try {
            executor.execute(() -> {
                try {
                    result.complete(insert(tag, payload));
                } catch (EventLogException e) {
                    result.completeExceptionally(e);
                } catch (RuntimeException e) {
                    result.completeExceptionally(EventLogException.unavailable(tag, e));
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(EventLogException.closed());
        }
        return result;
    }

    private Event<Object> insert(String tag, Object payload) throws EventLogException {
        String type = serialization.typeOf(payload);
        int payloadVersion = serialization.payloadVersion(payload);
        String data = serialization.serialize(payload);
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        try (Connection connection = ds.getConnection();
                PreparedStatement insert = schema.insertEvent(connection)) {
            schema.prepareInsert(insert, tag, timestamp, type, payloadVersion, data);
            insert.executeUpdate();
            try (ResultSet keys = insert.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw EventLogException.rejected(tag, "database did not assign a sequence number");
                }
                Event<Object> event = new Event<>(tag, payload, schema.readGeneratedSequence(keys), timestamp);
                logger.debug("Appended {}", event);
                return event;
            }
        } catch (SQLException e) {
            throw EventLogException.unavailable(tag, e);
        }
    }

    @Override
    public EventSubscription subscribe(TagFilter filter, long afterSequence, Consumer<? super Event<Object>> consumer,
            Consumer<? super Throwable> onFailure) {
        PollingSubscription subscription = new PollingSubscription(filter, afterSequence, consumer, onFailure);
        if (closed) {
            subscription.close();
            return subscription;
        }
        subscriptions.add(subscription);
        try {
            subscription.start(executor.scheduleWithFixedDelay(subscription::poll, 0, pollInterval.toMillis(),
                    TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            subscription.close();
            onFailure.accept(EventLogException.closed());
        }
        return subscription;
    }

    @Override
    public StoredEvents readEvents(TagFilter filter, long afterSequence) {
        try {
            return new JdbcStoredEvents(filter, afterSequence);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access datastore", e);
        }
    }

    @Override
    public long lastSequence() {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectLastSequence(connection);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readSequence(rs) : 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access datastore", e);
        }
    }

    @Override
    public void close() {
        closed = true;
        subscriptions.forEach(PollingSubscription::close);
    }

    private static Set<String> tagsOf(TagFilter filter) {
        return filter instanceof TagFilter.Tags ? ((TagFilter.Tags) filter).getTags() : null;
    }

    /**
     * Find the highest sequence number up to which every event is either committed or known to be rolled back.
     * @param connection connection to use
     * @param afterSequence sequence number already read
     * @param maxRows maximum number of sequence numbers to scan, 0 for unlimited
     * @param reportSkips whether skipped numbers are worth a warning
     * @return the horizon, {@code afterSequence} when no further event can be read yet
     */
    private long committedHorizon(Connection connection, long afterSequence, int maxRows, boolean reportSkips)
            throws SQLException {
        long horizon = afterSequence;
        Instant abandonedBefore = clock.instant().minus(gapTimeout);
        try (PreparedStatement st = schema.selectSequences(connection, afterSequence, maxRows);
                ResultSet rs = st.executeQuery()) {
            while (rs.next()) {
                long sequenceNo = schema.readSequence(rs);
                if (sequenceNo > horizon + 1) {
                    if (!schema.readTimestamp(rs).isBefore(abandonedBefore)) {
                        logger.debug("Waiting for events {} to {} to commit", horizon + 1, sequenceNo - 1);
                        break;
                    }
                    if (reportSkips) {
                        logger.warn("Events {} to {} were not committed within {}, skipping them", horizon + 1,
                                sequenceNo - 1, gapTimeout);
                    }
                }
                horizon = sequenceNo;
            }
        }
        return horizon;
    }

    /**
     * Read event at current row of the result set.
     * @return the event, or null when it cannot be deserialized in lenient mode
     * @throws EventLogException when the event cannot be deserialized in strict mode
     */
    private Event<Object> readEvent(ResultSet rs) throws SQLException, EventLogException {
        long sequenceNo = schema.readSequence(rs);
        String type = schema.readEventType(rs);
        Object payload;
        try {
            payload = serialization.deserialize(schema.readEventPayloadVersion(rs), schema.readEventPayload(rs), type);
        } catch (EventLogException e) {
            if (isStrict()) {
                throw EventLogException.deserializationFailed(sequenceNo, type, e);
            }
            logger.error("Could not deserialize event {} of type {}", sequenceNo, type, e);
            return null;
        }
        if (payload == null) {
            if (isStrict()) {
                throw EventLogException.deserializationFailed(sequenceNo, type, null);
            }
            logger.error("Skipping event {} of unknown type {}", sequenceNo, type);
            return null;
        }
        return new Event<>(schema.readTag(rs), payload, sequenceNo, schema.readTimestamp(rs));
    }

    class PollingSubscription implements EventSubscription {
        private final TagFilter filter;
        private final Consumer<? super Event<Object>> consumer;
        private final Consumer<? super Throwable> onFailure;
        private long lastSeen;
        private volatile ScheduledFuture<?> polling;
        private volatile boolean closed;

        PollingSubscription(TagFilter filter, long afterSequence, Consumer<? super Event<Object>> consumer,
                Consumer<? super Throwable> onFailure) {
            this.filter = Objects.requireNonNull(filter);
            this.consumer = Objects.requireNonNull(consumer);
            this.onFailure = Objects.requireNonNull(onFailure);
            this.lastSeen = afterSequence;
        }

        void start(ScheduledFuture<?> polling) {
            this.polling = polling;
            if (closed) {
                polling.cancel(false);
            }
        }

        /**
         * Deliver all events appended since last poll. Exceptions must not escape, they would silently end the
         * periodic task.
         */
        synchronized void poll() {
            if (closed) {
                return;
            }
            try {
                boolean advanced;
                do {
                    advanced = pollBatch();
                } while (advanced && !closed);
            } catch (SQLException e) {
                logger.warn("Polling of events after {} failed, will retry in {}", lastSeen, pollInterval, e);
            } catch (EventLogException e) {
                logger.error("Subscription to {} ends at unreadable event", filter, e);
                close();
                onFailure.accept(e);
            }
        }

        /**
         * @return true when the subscription advanced, and there may be more events to read
         */
        private boolean pollBatch() throws SQLException, EventLogException {
            long start = lastSeen;
            try (Connection connection = ds.getConnection()) {
                long horizon = committedHorizon(connection, start, BATCH_SIZE, true);
                if (horizon == start) {
                    return false;
                }
                try (PreparedStatement st = schema.selectEvents(connection, tagsOf(filter), start, horizon);
                        ResultSet rs = st.executeQuery()) {
                    while (!closed && rs.next()) {
                        Event<Object> event = readEvent(rs);
                        lastSeen = schema.readSequence(rs);
                        if (event != null && filter.accepts(event)) {
                            deliver(event);
                        }
                    }
                }
                if (!closed) {
                    lastSeen = horizon;
                }
            }
            return true;
        }

        private void deliver(Event<Object> event) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                logger.error("Subscriber {} failed to accept {}", consumer, event, e);
            }
        }

        @Override
        public void close() {
            closed = true;
            subscriptions.remove(this);
            ScheduledFuture<?> current = polling;
            if (current != null) {
                current.cancel(false);
            }
        }

        @Override
        public boolean isClosed() {
            return closed;
        }
    }

    class JdbcStoredEvents implements StoredEvents {
        private final TagFilter filter;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(TagFilter filter, long afterSequence) throws SQLException {
            this.filter = Objects.requireNonNull(filter);
            try {
                connection = ds.getConnection();
                long horizon = committedHorizon(connection, afterSequence, 0, false);
                statement = schema.selectEvents(connection, tagsOf(filter), afterSequence, horizon);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        private Event<Object> next() throws SQLException {
            while (!stop && resultSet.next()) {
                try {
                    Event<Object> event = readEvent(resultSet);
                    if (event != null && filter.accepts(event)) {
                        return event;
                    }
                } catch (EventLogException e) {
                    throw new IllegalStateException(e.getMessage(), e);
                }
            }
            return null;
        }

        private void startIteration() {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
        }

        @Override
        public void foreach(Consumer<? super Event<Object>> consumer) {
            startIteration();
            try {
                Event<Object> event;
                while ((event = next()) != null) {
                    consumer.accept(event);
                }
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super Event<Object>, R> reducer) {
            startIteration();
            try {
                R result = initial;
                Event<Object> event;
                while ((event = next()) != null) {
                    result = reducer.apply(result, event);
                }
                return result;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.warn("Suppressing cleanup exception", e);
                }
            }
        }
    }
}
