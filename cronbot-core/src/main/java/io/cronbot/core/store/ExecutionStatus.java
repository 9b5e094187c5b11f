package io.cronbot.core.store;

public enum ExecutionStatus {
    SUCCESS,
    ERROR,
    TIMEOUT
}
