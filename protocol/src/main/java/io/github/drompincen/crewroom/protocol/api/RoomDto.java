package io.github.drompincen.crewroom.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record RoomDto(
        String id,
        String name,
        RoomType type,
        List<String> participants,
        String owner,
        Instant createdAt,
        @JsonProperty("isDefault") boolean isDefault
) {
    public RoomDto {
        participants = participants != null ? List.copyOf(participants) : List.of();
    }

    public boolean hasParticipant(String participantId) {
        return participants.contains(participantId);
    }

    public RoomSummary toSummary() {
        return new RoomSummary(id, type, participants.size(), isDefault);
    }
}
