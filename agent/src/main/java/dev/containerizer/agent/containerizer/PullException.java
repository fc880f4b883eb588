package dev.containerizer.agent.containerizer;

public class PullException extends ContainerizerException {

    public PullException(String message, Throwable cause) {
        super(message, cause);
    }
}
