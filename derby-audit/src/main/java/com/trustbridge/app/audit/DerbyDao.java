package com.trustbridge.app.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustbridge.models.audit.AuditEvent;
import io.micrometer.core.annotation.Timed;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Timed
@Slf4j
@AllArgsConstructor
public class DerbyDao {
    private static final String ALREADY_EXISTS = "X0Y32";

    private final String derbyUrl;
    private final ObjectMapper objectMapper;

    @PostConstruct
    public void init() throws SQLException {
        createIfMissing("CREATE TABLE audit_events (id BIGINT PRIMARY KEY GENERATED ALWAYS AS IDENTITY(START WITH 1, INCREMENT BY 1), "
                + "event_id VARCHAR(64) NOT NULL, event_time TIMESTAMP NOT NULL, event_level VARCHAR(16), event_action VARCHAR(64), event LONG VARCHAR)");
        createIfMissing("CREATE INDEX audit_events_time ON audit_events (event_time)");
    }

    private void createIfMissing(String ddl) throws SQLException {
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            if (!ALREADY_EXISTS.equals(e.getSQLState())) {
                throw e;
            }
        }
    }

    /**
     * Inserts the batch in a single transaction, so either every event of the batch is stored or none is.
     */
    public void insertAuditEvents(List<AuditEvent> events) throws SQLException, JsonProcessingException {
        try (Connection connection = DriverManager.getConnection(derbyUrl)) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO audit_events (event_id, event_time, event_level, event_action, event) VALUES (?, ?, ?, ?, ?)")) {
                for (AuditEvent event : events) {
                    statement.setString(1, event.getEventId());
                    statement.setTimestamp(2, Timestamp.from(event.getTimestamp()));
                    statement.setString(3, event.getLevel() == null ? null : event.getLevel().name());
                    statement.setString(4, event.getAction() == null ? null : event.getAction().name());
                    statement.setString(5, objectMapper.writeValueAsString(event));
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (SQLException | JsonProcessingException e) {
                connection.rollback();
                throw e;
            }
        }
    }

    public List<AuditEvent> fetchAuditEvents(Instant from, Instant to) throws SQLException, JsonProcessingException {
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                PreparedStatement statement = connection.prepareStatement(
                        "SELECT event FROM audit_events WHERE event_time >= ? AND event_time <= ? ORDER BY id")) {
            statement.setTimestamp(1, Timestamp.from(from));
            statement.setTimestamp(2, Timestamp.from(to));
            List<AuditEvent> events = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    events.add(objectMapper.readValue(resultSet.getString(1), AuditEvent.class));
                }
            }
            return events;
        }
    }

    public int deleteAuditEventsBefore(Instant cutoff) throws SQLException {
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                PreparedStatement statement = connection.prepareStatement("DELETE FROM audit_events WHERE event_time < ?")) {
            statement.setTimestamp(1, Timestamp.from(cutoff));
            return statement.executeUpdate();
        }
    }

    public long countAuditEvents() throws SQLException {
        try (Connection connection = DriverManager.getConnection(derbyUrl);
                Statement statement = connection.createStatement();
                ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM audit_events")) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }

    /**
     * Shuts the embedded database down. Derby reports a successful shutdown of a single database with SQL state 08006.
     */
    public void shutdown() throws SQLException {
        String shutdownUrl = derbyUrl.split(";", 2)[0] + ";shutdown=true";
        try {
            DriverManager.getConnection(shutdownUrl).close();
        } catch (SQLException e) {
            if (!"08006".equals(e.getSQLState())) {
                throw e;
            }
            log.info("Derby audit database shut down");
        }
    }
}
