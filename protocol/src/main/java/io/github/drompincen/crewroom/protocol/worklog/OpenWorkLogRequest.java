package io.github.drompincen.crewroom.protocol.worklog;

public record OpenWorkLogRequest(
        String sessionKey,
        String roomId,
        String query
) {}
