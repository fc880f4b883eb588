package dev.containerizer.agent.model;

import java.util.Optional;

/**
 * Final outcome of a container's life.
 */
public record Termination(Reason reason, String message, Integer status) {

    public enum Reason {
        EXITED,
        KILLED,
        OOM,
        DESTROYED
    }

    // Exit statuses above this value mean the process died from a signal.
    private static final int SIGNAL_STATUS_BASE = 128;

    public static Termination exited(int status) {
        if (status > SIGNAL_STATUS_BASE) {
            return new Termination(Reason.KILLED,
                    "Container killed by signal " + (status - SIGNAL_STATUS_BASE), status);
        }
        return new Termination(Reason.EXITED, "Container exited with status " + status, status);
    }

    public static Termination oom(Integer status) {
        return new Termination(Reason.OOM, "Container exceeded its memory limit", status);
    }

    public static Termination destroyed(String message, Integer status) {
        return new Termination(Reason.DESTROYED, message, status);
    }

    public boolean killed() {
        return reason == Reason.KILLED || reason == Reason.DESTROYED;
    }

    public Optional<Integer> optionalStatus() {
        return Optional.ofNullable(status);
    }
}
