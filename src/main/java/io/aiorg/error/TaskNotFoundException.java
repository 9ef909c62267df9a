package io.aiorg.error;

public class TaskNotFoundException extends AiorgException {
    public TaskNotFoundException(String message) {
        super(ErrorCode.TASK_NOT_FOUND, message);
    }
}
