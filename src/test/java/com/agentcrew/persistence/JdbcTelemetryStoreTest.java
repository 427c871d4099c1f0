package com.agentcrew.persistence;

import com.agentcrew.telemetry.TelemetryEvent;
import com.agentcrew.telemetry.TelemetryKind;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcTelemetryStoreTest {

    private static DataSource dataSource(PreparedStatement ps) throws SQLException {
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);
        return ds;
    }

    @Test
    void saveAllBatchesEveryEvent() throws Exception {
        var ps = mock(PreparedStatement.class);
        var store = new JdbcTelemetryStore(dataSource(ps));
        var t0 = Instant.parse("2026-03-01T10:00:00Z");

        store.saveAll(List.of(
                new TelemetryEvent("t1", TelemetryKind.ORACLE_CALL, "oracle", t0, t0.plusMillis(40),
                        true, null, "gpt-4o-mini", 1200, 300, 0.0009),
                new TelemetryEvent("t1", TelemetryKind.AGENT_CALL, "ask_writer", t0, t0.plusMillis(90),
                        false, "AGENT_UNAVAILABLE: timeout", null, 0, 0, 0)));

        verify(ps).setString(2, "ORACLE_CALL");
        verify(ps).setString(3, "ask_writer");
        verify(ps).setInt(9, 1200);
        verify(ps, times(2)).addBatch();
        verify(ps).executeBatch();
    }

    @Test
    void saveAllSkipsEmptyBatch() throws Exception {
        var ds = mock(DataSource.class);
        new JdbcTelemetryStore(ds).saveAll(List.of());
        verify(ds, never()).getConnection();
    }

    @Test
    void findBetweenReadsEventsInWindow() throws Exception {
        var t0 = Instant.parse("2026-03-01T10:00:00Z");
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true, false);
        when(rs.getString("task_id")).thenReturn("t7");
        when(rs.getString("kind")).thenReturn("ORACLE_CALL");
        when(rs.getString("target")).thenReturn("oracle");
        when(rs.getTimestamp("started_at")).thenReturn(Timestamp.from(t0));
        when(rs.getTimestamp("ended_at")).thenReturn(Timestamp.from(t0.plusMillis(25)));
        when(rs.getBoolean("success")).thenReturn(true);
        when(rs.getString("model")).thenReturn("gpt-4o-mini");
        when(rs.getInt("prompt_tokens")).thenReturn(800);
        when(rs.getInt("completion_tokens")).thenReturn(100);
        when(rs.getBigDecimal("cost_usd")).thenReturn(BigDecimal.valueOf(0.0003));
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);

        var events = new JdbcTelemetryStore(dataSource(ps)).findBetween(t0, t0.plusSeconds(60));

        verify(ps).setTimestamp(1, Timestamp.from(t0));
        verify(ps).setTimestamp(2, Timestamp.from(t0.plusSeconds(60)));
        assertEquals(1, events.size());
        assertEquals("t7", events.get(0).taskId());
        assertEquals(Duration.ofMillis(25), events.get(0).latency());
        assertEquals(900, events.get(0).totalTokens());
    }

    @Test
    void findBetweenWrapsSqlErrors() throws Exception {
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenThrow(new SQLException("relation does not exist"));
        var store = new JdbcTelemetryStore(dataSource(ps));
        var t0 = Instant.parse("2026-03-01T10:00:00Z");

        var ex = assertThrows(RuntimeException.class, () -> store.findBetween(t0, t0.plusSeconds(1)));
        assertInstanceOf(SQLException.class, ex.getCause());
    }
}
