package io.github.drompincen.crewroom.protocol.worklog;

import java.time.Instant;
import java.util.List;

public record WorkLogDto(
        String logId,
        String sessionKey,
        String query,
        RoomContext roomContext,
        List<LogEntry> entries,
        Instant startedAt,
        Instant sealedAt,
        String finalOutput
) {
    public WorkLogDto {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public boolean sealed() {
        return sealedAt != null;
    }
}
