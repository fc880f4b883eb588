package dev.containerizer.agent.containerizer;

public class RunException extends ContainerizerException {

    public RunException(String message) {
        super(message);
    }

    public RunException(String message, Throwable cause) {
        super(message, cause);
    }
}
