package dev.containerizer.agent.cgroups;

import dev.containerizer.agent.containerizer.ContainerizerException;

public class CgroupException extends ContainerizerException {

    public CgroupException(String message) {
        super(message);
    }

    public CgroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
