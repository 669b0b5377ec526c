package com.wakecycle.tools.backend.service;

/**
 * Thrown when a task id does not match any task in the backlog.
 */
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task " + taskId + " not found");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
