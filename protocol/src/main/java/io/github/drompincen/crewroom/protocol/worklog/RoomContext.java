package io.github.drompincen.crewroom.protocol.worklog;

import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomType;

import java.util.List;

/**
 * Frozen copy of a room's identity and membership, taken when a work log is opened.
 */
public record RoomContext(
        String roomId,
        RoomType roomType,
        List<String> participants
) {
    public RoomContext {
        participants = participants != null ? List.copyOf(participants) : List.of();
    }

    public static RoomContext of(RoomDto room) {
        return new RoomContext(room.id(), room.type(), room.participants());
    }
}
