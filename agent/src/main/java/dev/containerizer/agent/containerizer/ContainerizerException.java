package dev.containerizer.agent.containerizer;

public class ContainerizerException extends RuntimeException {

    public ContainerizerException(String message) {
        super(message);
    }

    public ContainerizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
