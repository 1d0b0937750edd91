package io.github.drompincen.crewroom.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoomSummary(
        String id,
        RoomType type,
        int participantCount,
        @JsonProperty("isDefault") boolean isDefault
) {}
