package io.github.drompincen.crewroom.protocol.api;

public record ErrorResponse(String error, String message) {}
