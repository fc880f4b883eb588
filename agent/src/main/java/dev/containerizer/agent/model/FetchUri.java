package dev.containerizer.agent.model;

public record FetchUri(String value, boolean executable) {}
