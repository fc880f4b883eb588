package dev.containerizer.agent.model;

import java.util.Objects;

/**
 * Caller-supplied identifier of one container's whole lifecycle.
 */
public record ContainerId(String value) {

    public ContainerId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Container id must not be blank");
        }
    }

    public static ContainerId of(String value) {
        return new ContainerId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
