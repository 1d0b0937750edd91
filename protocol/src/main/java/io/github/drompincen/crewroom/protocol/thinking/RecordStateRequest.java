package io.github.drompincen.crewroom.protocol.thinking;

public record RecordStateRequest(boolean expanded) {}
