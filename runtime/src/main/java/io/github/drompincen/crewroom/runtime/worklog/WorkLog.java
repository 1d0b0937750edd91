package io.github.drompincen.crewroom.runtime.worklog;

import io.github.drompincen.crewroom.protocol.worklog.LogEntry;
import io.github.drompincen.crewroom.protocol.worklog.RoomContext;
import io.github.drompincen.crewroom.protocol.worklog.WorkLogDto;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Append-only record of what happened while one request was processed. Only
 * {@link WorkLogManager} appends or seals; everyone else reads copies.
 */
public class WorkLog {

    private final String logId;
    private final String sessionKey;
    private final String query;
    private final RoomContext roomContext;
    private final Instant startedAt;
    private final long openOrder;
    private final List<LogEntry> entries = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Instant sealedAt;
    private volatile String finalOutput;

    WorkLog(String logId, String sessionKey, String query, RoomContext roomContext,
            Instant startedAt, long openOrder) {
        this.logId = logId;
        this.sessionKey = sessionKey;
        this.query = query;
        this.roomContext = roomContext;
        this.startedAt = startedAt;
        this.openOrder = openOrder;
    }

    /**
     * Rebuilds a log from its stored form. Stored logs are always sealed.
     */
    static WorkLog restore(WorkLogDto stored, long openOrder) {
        WorkLog workLog = new WorkLog(stored.logId(), stored.sessionKey(), stored.query(), stored.roomContext(),
                stored.startedAt(), openOrder);
        workLog.entries.addAll(stored.entries());
        workLog.finalOutput = stored.finalOutput();
        workLog.sealedAt = stored.sealedAt();
        return workLog;
    }

    LogEntry append(LogEntry draft, Instant at) {
        lock.lock();
        try {
            if (sealedAt != null) {
                throw new SealedLogException(logId);
            }
            LogEntry entry = draft.sequenced(entries.size() + 1L, at);
            entries.add(entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands the sealed form to {@code store} before the log turns sealed. If the store throws,
     * the log stays open and unchanged.
     *
     * @return false if the log was already sealed
     */
    boolean seal(String output, Instant at, Consumer<WorkLogDto> store) {
        lock.lock();
        try {
            if (sealedAt != null) return false;
            store.accept(new WorkLogDto(logId, sessionKey, query, roomContext, entries, startedAt, at, output));
            finalOutput = output;
            sealedAt = at;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public List<LogEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public WorkLogDto toDto() {
        lock.lock();
        try {
            return new WorkLogDto(logId, sessionKey, query, roomContext, entries, startedAt, sealedAt, finalOutput);
        } finally {
            lock.unlock();
        }
    }

    public WorkLogHandle handle() {
        return new WorkLogHandle(logId);
    }

    public boolean isSealed() {
        return sealedAt != null;
    }

    public Optional<Long> durationMs() {
        Instant end = sealedAt;
        return end == null ? Optional.empty() : Optional.of(Duration.between(startedAt, end).toMillis());
    }

    public String getLogId() { return logId; }
    public String getSessionKey() { return sessionKey; }
    public String getQuery() { return query; }
    public RoomContext getRoomContext() { return roomContext; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getSealedAt() { return sealedAt; }
    public String getFinalOutput() { return finalOutput; }

    long getOpenOrder() { return openOrder; }
}
