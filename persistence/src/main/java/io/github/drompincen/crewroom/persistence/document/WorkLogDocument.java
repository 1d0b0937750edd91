package io.github.drompincen.crewroom.persistence.document;

import io.github.drompincen.crewroom.protocol.worklog.LogEntry;
import io.github.drompincen.crewroom.protocol.worklog.RoomContext;
import io.github.drompincen.crewroom.protocol.worklog.WorkLogDto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored form of a sealed work log: one JSON record per log id.
 */
public class WorkLogDocument {

    private String logId;
    private String sessionKey;
    private String query;
    private RoomContext roomContext;
    private List<LogEntry> entries = new ArrayList<>();
    private Instant startedAt;
    private Instant sealedAt;
    private String finalOutput;

    public WorkLogDocument() {}

    public static WorkLogDocument fromDto(WorkLogDto dto) {
        WorkLogDocument doc = new WorkLogDocument();
        doc.setLogId(dto.logId());
        doc.setSessionKey(dto.sessionKey());
        doc.setQuery(dto.query());
        doc.setRoomContext(dto.roomContext());
        doc.setEntries(dto.entries());
        doc.setStartedAt(dto.startedAt());
        doc.setSealedAt(dto.sealedAt());
        doc.setFinalOutput(dto.finalOutput());
        return doc;
    }

    public WorkLogDto toDto() {
        return new WorkLogDto(logId, sessionKey, query, roomContext, entries, startedAt, sealedAt, finalOutput);
    }

    public String getLogId() { return logId; }
    public void setLogId(String logId) { this.logId = logId; }

    public String getSessionKey() { return sessionKey; }
    public void setSessionKey(String sessionKey) { this.sessionKey = sessionKey; }

    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }

    public RoomContext getRoomContext() { return roomContext; }
    public void setRoomContext(RoomContext roomContext) { this.roomContext = roomContext; }

    public List<LogEntry> getEntries() { return entries; }
    public void setEntries(List<LogEntry> entries) {
        this.entries = entries != null ? new ArrayList<>(entries) : new ArrayList<>();
    }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getSealedAt() { return sealedAt; }
    public void setSealedAt(Instant sealedAt) { this.sealedAt = sealedAt; }

    public String getFinalOutput() { return finalOutput; }
    public void setFinalOutput(String finalOutput) { this.finalOutput = finalOutput; }
}
