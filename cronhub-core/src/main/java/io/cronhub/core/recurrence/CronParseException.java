package io.cronhub.core.recurrence;

import io.cronhub.core.job.JobValidationException;

public final class CronParseException extends JobValidationException {
    private final String expression;

    public CronParseException(String expression, String message) {
        super("invalid cron expression '" + expression + "': " + message);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
