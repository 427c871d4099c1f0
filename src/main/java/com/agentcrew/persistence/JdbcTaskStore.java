package com.agentcrew.persistence;

import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.Task;
import com.agentcrew.shared.model.TaskMessage;
import com.agentcrew.shared.model.TaskStatus;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Postgres-backed task store. Transcript sequences are allocated while holding a row lock
 * on the owning task, so concurrent appends to the same task never share a sequence.
 */
public class JdbcTaskStore implements TaskStore {

    private static final String TASK_COLUMNS =
            "id, title, description, crew_id, mode, status, result, error, created_at, started_at, completed_at";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcTaskStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcTaskStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Task create(String title, String description, String crewId, ExecutionMode mode) {
        var task = Task.pending(UUID.randomUUID().toString(), title, description, crewId, mode, clock.instant());
        var sql = "INSERT INTO tasks (id, title, description, crew_id, mode, status, created_at) VALUES (?,?,?,?,?,?,?)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, task.id());
            ps.setString(2, task.title());
            ps.setString(3, task.description());
            ps.setString(4, task.crewId());
            ps.setString(5, task.mode().name());
            ps.setString(6, task.status().name());
            ps.setTimestamp(7, Timestamp.from(task.createdAt()));
            ps.executeUpdate();
            return task;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> find(String taskId) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE id = ?")) {
            ps.setString(1, taskId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load task: " + taskId, e);
        }
    }

    @Override
    public boolean markInProgress(String taskId) {
        var sql = "UPDATE tasks SET status = 'IN_PROGRESS', started_at = ? WHERE id = ? AND status = 'PENDING'";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, taskId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to start task: " + taskId, e);
        }
    }

    @Override
    public void markCompleted(String taskId, String result) {
        finish(taskId, TaskStatus.COMPLETED, "result", result);
    }

    @Override
    public void markFailed(String taskId, String error) {
        finish(taskId, TaskStatus.FAILED, "error", error);
    }

    @Override
    public TaskMessage appendMessage(String taskId, MessageAuthor author, String authorName, String content) {
        var now = clock.instant();
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                lockTask(conn, taskId);
                long sequence = insertMessage(conn, taskId, author, authorName, content, now);
                conn.commit();
                return new TaskMessage(taskId, sequence, author, authorName, content, now);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            }
        } catch (TaskNotFoundException e) {
            throw e;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append message to task: " + taskId, e);
        }
    }

    @Override
    public List<TaskMessage> messages(String taskId) {
        var sql = "SELECT sequence, author, author_name, content, created_at FROM task_messages "
                + "WHERE task_id = ? ORDER BY sequence";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (var rs = ps.executeQuery()) {
                var messages = new ArrayList<TaskMessage>();
                while (rs.next()) {
                    messages.add(new TaskMessage(taskId,
                            rs.getLong("sequence"),
                            MessageAuthor.valueOf(rs.getString("author")),
                            rs.getString("author_name"),
                            rs.getString("content"),
                            rs.getTimestamp("created_at").toInstant()));
                }
                return messages;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load messages for task: " + taskId, e);
        }
    }

    private void finish(String taskId, TaskStatus status, String column, String value) {
        var sql = "UPDATE tasks SET status = ?, " + column + " = ?, completed_at = ? WHERE id = ? AND status = 'IN_PROGRESS'";
        int updated;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.name());
            ps.setString(2, value);
            ps.setTimestamp(3, Timestamp.from(clock.instant()));
            ps.setString(4, taskId);
            updated = ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish task: " + taskId, e);
        }
        if (updated == 0) {
            var current = find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            throw new IllegalStateException("Task " + taskId + " is " + current.status() + ", not IN_PROGRESS");
        }
    }

    private void lockTask(Connection conn, String taskId) throws SQLException {
        try (var ps = conn.prepareStatement("SELECT id FROM tasks WHERE id = ? FOR UPDATE")) {
            ps.setString(1, taskId);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) throw new TaskNotFoundException(taskId);
            }
        }
    }

    private long insertMessage(Connection conn, String taskId, MessageAuthor author, String authorName,
                               String content, Instant at) throws SQLException {
        var sql = "INSERT INTO task_messages (task_id, sequence, author, author_name, content, created_at) "
                + "SELECT ?, COALESCE(MAX(sequence), 0) + 1, ?, ?, ?, ? FROM task_messages WHERE task_id = ? "
                + "RETURNING sequence";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            ps.setString(2, author.name());
            ps.setString(3, authorName);
            ps.setString(4, content);
            ps.setTimestamp(5, Timestamp.from(at));
            ps.setString(6, taskId);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    private static Task mapTask(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("crew_id"),
                ExecutionMode.valueOf(rs.getString("mode")),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getString("result"),
                rs.getString("error"),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("started_at")),
                instant(rs.getTimestamp("completed_at")));
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
