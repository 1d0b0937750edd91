package io.github.drompincen.crewroom.protocol.api;

import java.util.List;

public record CreateRoomRequest(
        String id,
        String type,
        List<String> participants
) {}
