package io.github.drompincen.crewroom.protocol.worklog;

public record SealRequest(String finalOutput) {}
