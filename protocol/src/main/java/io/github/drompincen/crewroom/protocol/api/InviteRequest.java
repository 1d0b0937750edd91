package io.github.drompincen.crewroom.protocol.api;

public record InviteRequest(String participantId) {}
