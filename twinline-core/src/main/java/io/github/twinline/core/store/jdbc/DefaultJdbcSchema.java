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
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * JDBC schema with single event table for all tags:
 * <em>eventTable</em>(SEQUENCE_NO, TAG, APPENDED_AT, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD), where SEQUENCE_NO
 * is an identity column and primary key.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    public static final String DEFAULT_TABLE = "TWINLINE_EVENTS";

    private final String eventTable;

    public DefaultJdbcSchema() {
        this(DEFAULT_TABLE);
    }

    public DefaultJdbcSchema(String eventTable) {
        this.eventTable = eventTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    @Override
    public void createTable(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS " + getEventTable() + " ("
                    + "SEQUENCE_NO BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "TAG VARCHAR(255) NOT NULL, "
                    + "APPENDED_AT TIMESTAMP NOT NULL, "
                    + "EVENT_TYPE VARCHAR(255) NOT NULL, "
                    + "PAYLOAD_VERSION INT NOT NULL, "
                    + "PAYLOAD CLOB NOT NULL)");
        }
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (TAG, APPENDED_AT, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD) VALUES (?,?,?,?,?)",
                new String[] {"SEQUENCE_NO"});
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, String tag, Instant timestamp, String type,
            int payloadVersion, String payload) throws SQLException {
        insertEvent.setString(1, tag);
        insertEvent.setTimestamp(2, Timestamp.from(timestamp));
        insertEvent.setString(3, type);
        insertEvent.setInt(4, payloadVersion);
        insertEvent.setString(5, payload);
    }

    @Override
    protected long readGeneratedSequence(ResultSet generatedKeys) throws SQLException {
        return generatedKeys.getLong(1);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, Set<String> tags, long afterSequence,
            long upToSequence) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT SEQUENCE_NO, TAG, APPENDED_AT, EVENT_TYPE, PAYLOAD_VERSION, "
                + "PAYLOAD FROM ").append(getEventTable()).append(" WHERE SEQUENCE_NO > ? AND SEQUENCE_NO <= ?");
        if (tags != null) {
            sql.append(" AND TAG IN (").append(String.join(",", Collections.nCopies(tags.size(), "?"))).append(")");
        }
        sql.append(" ORDER BY SEQUENCE_NO");
        PreparedStatement st = connection.prepareStatement(sql.toString());
        int index = 1;
        st.setLong(index++, afterSequence);
        st.setLong(index++, upToSequence);
        if (tags != null) {
            for (String tag : tags) {
                st.setString(index++, tag);
            }
        }
        return st;
    }

    @Override
    protected PreparedStatement selectSequences(Connection connection, long afterSequence, int maxRows)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT SEQUENCE_NO, TAG, APPENDED_AT FROM "
                + getEventTable() + " WHERE SEQUENCE_NO > ? ORDER BY SEQUENCE_NO");
        st.setLong(1, afterSequence);
        st.setMaxRows(maxRows);
        return st;
    }

    @Override
    protected PreparedStatement selectLastSequence(Connection connection) throws SQLException {
        return connection.prepareStatement("SELECT COALESCE(MAX(SEQUENCE_NO), 0) FROM " + getEventTable());
    }

    @Override
    protected long readSequence(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected String readTag(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected Instant readTimestamp(ResultSet rs) throws SQLException {
        return rs.getTimestamp(3).toInstant();
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(5);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(6);
    }
}
