package dev.containerizer.agent.containerizer;

public class FetchException extends ContainerizerException {

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
