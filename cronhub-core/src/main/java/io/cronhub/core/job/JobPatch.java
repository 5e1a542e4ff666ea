package io.cronhub.core.job;

/**
 * Partial update of a job. A {@code null} component leaves the stored value untouched.
 */
public record JobPatch(
    String name,
    String command,
    String recurrence,
    Boolean enabled
) {

    public static JobPatch enabled(boolean enabled) {
        return new JobPatch(null, null, null, enabled);
    }

    public boolean isEmpty() {
        return name == null && command == null && recurrence == null && enabled == null;
    }
}
