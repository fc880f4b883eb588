package dev.containerizer.agent.model;

public record ResourceStatistics(
    double timestamp,
    double cpusUserTimeSecs,
    double cpusSystemTimeSecs,
    double cpusLimit,
    long memRssBytes,
    long memLimitBytes
) {}
