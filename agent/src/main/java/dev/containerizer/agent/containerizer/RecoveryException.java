package dev.containerizer.agent.containerizer;

/**
 * Persisted state and the runtime disagree in a way that cannot be reconciled. Fatal to the agent.
 */
public class RecoveryException extends ContainerizerException {

    public RecoveryException(String message) {
        super(message);
    }

    public RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
