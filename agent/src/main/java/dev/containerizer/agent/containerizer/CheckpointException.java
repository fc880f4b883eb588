package dev.containerizer.agent.containerizer;

public class CheckpointException extends ContainerizerException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
