package dev.containerizer.agent.docker;

public class DockerRuntimeException extends RuntimeException {

    private final boolean notFound;

    public DockerRuntimeException(String message) {
        this(message, null, false);
    }

    public DockerRuntimeException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private DockerRuntimeException(String message, Throwable cause, boolean notFound) {
        super(message, cause);
        this.notFound = notFound;
    }

    public static DockerRuntimeException notFound(String name, Throwable cause) {
        return new DockerRuntimeException("No such container: " + name, cause, true);
    }

    public boolean isNotFound() {
        return notFound;
    }
}
