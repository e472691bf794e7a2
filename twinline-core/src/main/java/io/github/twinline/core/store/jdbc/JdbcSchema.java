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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Set;

/**
 * Queries {@link JdbcEventLog} issues against the database. Subclass to adapt the log to existing tables or to
 * a specific SQL dialect.
 *
 * <p>Statements returned by this class are closed by the caller.</p>
 */
public abstract class JdbcSchema {

    /**
     * Create the event table, when it does not exist yet.
     * @param connection connection to use
     * @throws SQLException when table cannot be created
     */
    public abstract void createTable(Connection connection) throws SQLException;

    /**
     * Statement inserting single event, that returns generated sequence number as generated key.
     */
    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, String tag, Instant timestamp, String type,
            int payloadVersion, String payload) throws SQLException;

    protected abstract long readGeneratedSequence(ResultSet generatedKeys) throws SQLException;

    /**
     * Select events in sequence order.
     * @param connection connection to use
     * @param tags tags to select, or {@code null} when the caller filters the events itself
     * @param afterSequence lower exclusive bound of sequence numbers
     * @param upToSequence upper inclusive bound of sequence numbers
     * @return prepared statement
     * @throws SQLException when statement cannot be prepared
     */
    protected abstract PreparedStatement selectEvents(Connection connection, Set<String> tags, long afterSequence,
            long upToSequence) throws SQLException;

    /**
     * Select sequence numbers of all committed events regardless of tag, in sequence order. Columns must be
     * readable by {@link #readSequence(ResultSet)} and {@link #readTimestamp(ResultSet)}.
     * @param connection connection to use
     * @param afterSequence lower exclusive bound of sequence numbers
     * @param maxRows maximum number of rows to return, 0 for unlimited
     * @return prepared statement
     * @throws SQLException when statement cannot be prepared
     */
    protected abstract PreparedStatement selectSequences(Connection connection, long afterSequence, int maxRows)
            throws SQLException;

    protected abstract PreparedStatement selectLastSequence(Connection connection) throws SQLException;

    protected abstract long readSequence(ResultSet rs) throws SQLException;

    protected abstract String readTag(ResultSet rs) throws SQLException;

    protected abstract Instant readTimestamp(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;
}
