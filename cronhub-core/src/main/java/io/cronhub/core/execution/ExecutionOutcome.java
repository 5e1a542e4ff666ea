package io.cronhub.core.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExecutionOutcome {
    SUCCESS("success"),
    FAILURE("failure"),
    SPAWN_ERROR("spawn-error"),
    /** Abandoned at shutdown before the command finished. */
    INCOMPLETE("incomplete");

    private final String tag;

    ExecutionOutcome(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static ExecutionOutcome fromTag(String tag) {
        String normalized = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        for (ExecutionOutcome outcome : values()) {
            if (outcome.tag.equals(normalized)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("unknown execution outcome: " + tag);
    }
}
