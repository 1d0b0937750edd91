package io.github.drompincen.crewroom.protocol.api;

public record SwitchFocusRequest(String roomId) {}
