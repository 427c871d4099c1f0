package com.agentcrew.persistence;

import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class JdbcTaskStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private Connection conn;
    private JdbcTaskStore store;

    @BeforeEach
    void setUp() throws Exception {
        conn = mock(Connection.class);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);
        store = new JdbcTaskStore(ds, clock);
    }

    @Test
    void createInsertsPendingRow() throws Exception {
        var ps = mock(PreparedStatement.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);

        var task = store.create("Report", "Write it", "c1", ExecutionMode.FIXED_PLAN);

        verify(ps).setString(1, task.id());
        verify(ps).setString(2, "Report");
        verify(ps).setString(4, "c1");
        verify(ps).setString(5, "FIXED_PLAN");
        verify(ps).setString(6, "PENDING");
        verify(ps).setTimestamp(7, Timestamp.from(clock.instant()));
        verify(ps).executeUpdate();
    }

    @Test
    void markInProgressIsConditionalOnPending() throws Exception {
        var ps = mock(PreparedStatement.class);
        when(conn.prepareStatement(contains("status = 'PENDING'"))).thenReturn(ps);
        when(ps.executeUpdate()).thenReturn(1, 0);

        assertTrue(store.markInProgress("t1"));
        assertFalse(store.markInProgress("t1"));
    }

    @Test
    void appendLocksTaskAndReturnsAllocatedSequence() throws Exception {
        var lockRs = mock(ResultSet.class);
        when(lockRs.next()).thenReturn(true);
        var lockPs = mock(PreparedStatement.class);
        when(lockPs.executeQuery()).thenReturn(lockRs);
        var insertRs = mock(ResultSet.class);
        when(insertRs.next()).thenReturn(true);
        when(insertRs.getLong(1)).thenReturn(4L);
        var insertPs = mock(PreparedStatement.class);
        when(insertPs.executeQuery()).thenReturn(insertRs);
        when(conn.prepareStatement(contains("FOR UPDATE"))).thenReturn(lockPs);
        when(conn.prepareStatement(startsWith("INSERT INTO task_messages"))).thenReturn(insertPs);

        var msg = store.appendMessage("t1", MessageAuthor.AGENT, "ask_writer", "draft");

        assertEquals(4L, msg.sequence());
        assertEquals("ask_writer", msg.authorName());
        var order = inOrder(conn, lockPs, insertPs);
        order.verify(conn).setAutoCommit(false);
        order.verify(lockPs).executeQuery();
        order.verify(insertPs).executeQuery();
        order.verify(conn).commit();
    }

    @Test
    void appendToMissingTaskRollsBack() throws Exception {
        var lockRs = mock(ResultSet.class);
        when(lockRs.next()).thenReturn(false);
        var lockPs = mock(PreparedStatement.class);
        when(lockPs.executeQuery()).thenReturn(lockRs);
        when(conn.prepareStatement(contains("FOR UPDATE"))).thenReturn(lockPs);

        assertThrows(TaskNotFoundException.class,
                () -> store.appendMessage("gone", MessageAuthor.SYSTEM, null, "x"));
        verify(conn).rollback();
        verify(conn, never()).commit();
    }

    @Test
    void finishingTerminalTaskIsRejected() throws Exception {
        var updatePs = mock(PreparedStatement.class);
        when(updatePs.executeUpdate()).thenReturn(0);
        when(conn.prepareStatement(startsWith("UPDATE tasks SET status = ?"))).thenReturn(updatePs);

        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        when(rs.getString("id")).thenReturn("t1");
        when(rs.getString("mode")).thenReturn("DYNAMIC");
        when(rs.getString("status")).thenReturn("COMPLETED");
        when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(clock.instant()));
        var selectPs = mock(PreparedStatement.class);
        when(selectPs.executeQuery()).thenReturn(rs);
        when(conn.prepareStatement(startsWith("SELECT"))).thenReturn(selectPs);

        var ex = assertThrows(IllegalStateException.class, () -> store.markFailed("t1", "boom"));
        assertTrue(ex.getMessage().contains(TaskStatus.COMPLETED.name()));
    }

    @Test
    void sqlErrorsAreWrapped() throws Exception {
        when(conn.prepareStatement(anyString())).thenThrow(new SQLException("connection reset"));

        var ex = assertThrows(RuntimeException.class, () -> store.find("t9"));
        assertTrue(ex.getMessage().contains("t9"));
        assertInstanceOf(SQLException.class, ex.getCause());
    }
}
