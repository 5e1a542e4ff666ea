package io.cronhub.core.job;

import io.cronhub.core.recurrence.CronExpression;

/**
 * Rejects malformed job input before anything is written to the store.
 */
public final class JobValidator {

    private JobValidator() {
    }

    public static JobDraft validate(JobDraft draft) {
        if (draft == null) {
            throw new JobValidationException("job definition is required");
        }
        String name = required("name", draft.name());
        String command = required("command", draft.command());
        String recurrence = CronExpression.parse(required("schedule", draft.recurrence())).expression();
        return new JobDraft(name, command, recurrence, draft.enabled());
    }

    public static JobPatch validate(JobPatch patch) {
        if (patch == null || patch.isEmpty()) {
            throw new JobValidationException("no fields to update");
        }
        String name = patch.name() == null ? null : required("name", patch.name());
        String command = patch.command() == null ? null : required("command", patch.command());
        String recurrence = patch.recurrence() == null
            ? null
            : CronExpression.parse(required("schedule", patch.recurrence())).expression();
        return new JobPatch(name, command, recurrence, patch.enabled());
    }

    private static String required(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new JobValidationException(field + " is required");
        }
        return value.trim();
    }
}
