package com.agentcrew.persistence;

import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.Task;
import com.agentcrew.shared.model.TaskMessage;

import java.util.List;
import java.util.Optional;

public interface TaskStore {

    Task create(String title, String description, String crewId, ExecutionMode mode);

    Optional<Task> find(String taskId);

    /** Moves a task from PENDING to IN_PROGRESS; false when it was not PENDING. */
    boolean markInProgress(String taskId);

    void markCompleted(String taskId, String result);

    void markFailed(String taskId, String error);

    TaskMessage appendMessage(String taskId, MessageAuthor author, String authorName, String content);

    /** Messages in append order. */
    List<TaskMessage> messages(String taskId);
}
