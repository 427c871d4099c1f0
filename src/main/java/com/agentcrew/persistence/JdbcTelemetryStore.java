package com.agentcrew.persistence;

import com.agentcrew.telemetry.TelemetryEvent;
import com.agentcrew.telemetry.TelemetryKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class JdbcTelemetryStore implements TelemetryStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTelemetryStore.class);

    private static final String COLUMNS = "task_id, kind, target, started_at, ended_at, success, error, model, "
            + "prompt_tokens, completion_tokens, cost_usd";

    private final DataSource dataSource;

    public JdbcTelemetryStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void saveAll(Collection<TelemetryEvent> events) {
        if (events.isEmpty()) return;
        var sql = "INSERT INTO telemetry_events (task_id, kind, target, started_at, ended_at, success, error, "
                + "model, prompt_tokens, completion_tokens, cost_usd) VALUES (?,?,?,?,?,?,?,?,?,?,?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            for (var e : events) {
                ps.setString(1, e.taskId());
                ps.setString(2, e.kind().name());
                ps.setString(3, e.target());
                ps.setTimestamp(4, Timestamp.from(e.startedAt()));
                ps.setTimestamp(5, Timestamp.from(e.endedAt()));
                ps.setBoolean(6, e.success());
                ps.setString(7, e.error());
                ps.setString(8, e.model());
                ps.setInt(9, e.promptTokens());
                ps.setInt(10, e.completionTokens());
                ps.setBigDecimal(11, BigDecimal.valueOf(e.costUsd()));
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save telemetry for task: " + events.iterator().next().taskId(), e);
        }
    }

    @Override
    public List<TelemetryEvent> findByTask(String taskId) {
        var sql = "SELECT " + COLUMNS + " FROM telemetry_events WHERE task_id = ? ORDER BY id";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            return readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load telemetry for task: " + taskId, e);
        }
    }

    @Override
    public List<TelemetryEvent> findBetween(Instant from, Instant to) {
        var sql = "SELECT " + COLUMNS + " FROM telemetry_events WHERE started_at >= ? AND started_at < ? ORDER BY id";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(from));
            ps.setTimestamp(2, Timestamp.from(to));
            var events = readAll(ps);
            log.debug("Loaded {} telemetry events between {} and {}", events.size(), from, to);
            return events;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load telemetry between " + from + " and " + to, e);
        }
    }

    private static List<TelemetryEvent> readAll(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            var events = new ArrayList<TelemetryEvent>();
            while (rs.next()) {
                events.add(new TelemetryEvent(rs.getString("task_id"),
                        TelemetryKind.valueOf(rs.getString("kind")),
                        rs.getString("target"),
                        rs.getTimestamp("started_at").toInstant(),
                        rs.getTimestamp("ended_at").toInstant(),
                        rs.getBoolean("success"),
                        rs.getString("error"),
                        rs.getString("model"),
                        rs.getInt("prompt_tokens"),
                        rs.getInt("completion_tokens"),
                        rs.getBigDecimal("cost_usd").doubleValue()));
            }
            return events;
        }
    }
}
