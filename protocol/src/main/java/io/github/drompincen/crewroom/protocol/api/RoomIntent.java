package io.github.drompincen.crewroom.protocol.api;

import java.util.List;

/**
 * Structured outcome of intent detection about rooms. Produced outside this core and
 * validated before anything is created or invited.
 */
public record RoomIntent(
        boolean shouldCreateRoom,
        String roomName,
        RoomType roomType,
        List<Recommendation> recommendedParticipants
) {
    public record Recommendation(String name, String reason) {}

    public RoomIntent {
        recommendedParticipants = recommendedParticipants != null
                ? List.copyOf(recommendedParticipants) : List.of();
    }

    public static RoomIntent none() {
        return new RoomIntent(false, null, null, List.of());
    }

    public static RoomIntent createRoom(String roomName, RoomType roomType, List<Recommendation> participants) {
        return new RoomIntent(true, roomName, roomType, participants);
    }

    public boolean hasRecommendations() {
        return !recommendedParticipants.isEmpty();
    }
}
