package io.cronbot.core.job;

public enum JobKind {
    RECURRING,
    ONE_TIME
}
