package dev.containerizer.agent.model;

public record VolumeMount(String hostPath, String containerPath, boolean readOnly) {}
