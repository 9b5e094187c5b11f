package io.cronbot.core.schedule;

import io.cronbot.core.job.JobValidationException;

public final class InvalidScheduleExpressionException extends JobValidationException {
    private final String expression;

    public InvalidScheduleExpressionException(String expression, String reason) {
        super("Invalid schedule expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidScheduleExpressionException(String expression, String reason, Throwable cause) {
        super("Invalid schedule expression '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
