package io.cronhub.core.job;

public record JobDraft(
    String name,
    String command,
    String recurrence,
    boolean enabled
) {
}
