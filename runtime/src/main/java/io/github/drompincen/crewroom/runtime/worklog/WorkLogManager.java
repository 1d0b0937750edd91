package io.github.drompincen.crewroom.runtime.worklog;

import io.github.drompincen.crewroom.persistence.document.WorkLogDocument;
import io.github.drompincen.crewroom.persistence.repository.WorkLogRepository;
import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.worklog.LogEntry;
import io.github.drompincen.crewroom.protocol.worklog.RoomContext;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens, appends to, seals and indexes work logs. Appends to one log are serialized by that
 * log's lock; different logs never contend. Sealed logs are written to the
 * {@link WorkLogRepository} and stay readable after they leave the in-memory index.
 */
@Service
public class WorkLogManager {

    private static final Logger log = LoggerFactory.getLogger(WorkLogManager.class);

    public static final int DEFAULT_MAX_HISTORY = 50;
    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);

    private static final Comparator<WorkLog> OPEN_ORDER =
            Comparator.comparing(WorkLog::getStartedAt).thenComparingLong(WorkLog::getOpenOrder);

    private final Map<String, WorkLog> logsById = new ConcurrentHashMap<>();
    private final Map<String, List<WorkLog>> bySession = new ConcurrentHashMap<>();
    private final AtomicLong openCounter = new AtomicLong();
    private final WorkLogRepository repository;
    private final int maxHistoryPerSession;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public WorkLogManager(WorkLogRepository repository,
                          @Value("${crewroom.worklog.max-history-per-session:50}") int maxHistoryPerSession,
                          @Value("${crewroom.worklog.retention-days:30}") int retentionDays) {
        this(repository, maxHistoryPerSession, Duration.ofDays(retentionDays), Clock.systemUTC());
    }

    public WorkLogManager(WorkLogRepository repository) {
        this(repository, DEFAULT_MAX_HISTORY, DEFAULT_RETENTION, Clock.systemUTC());
    }

    WorkLogManager(WorkLogRepository repository, int maxHistoryPerSession, Duration retention, Clock clock) {
        if (maxHistoryPerSession < 1) {
            throw new IllegalArgumentException("maxHistoryPerSession must be at least 1");
        }
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive, was " + retention);
        }
        this.repository = Objects.requireNonNull(repository, "repository");
        this.maxHistoryPerSession = maxHistoryPerSession;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Drops logs past retention, then indexes the stored ones. Safe to call more than once.
     */
    @PostConstruct
    public void initialize() {
        cleanup();
        int restored = 0;
        for (WorkLogDocument doc : repository.loadAll()) {
            if (logsById.containsKey(doc.getLogId())) continue;
            WorkLog workLog = WorkLog.restore(doc.toDto(), openCounter.incrementAndGet());
            logsById.put(workLog.getLogId(), workLog);
            List<WorkLog> history = bySession.computeIfAbsent(workLog.getSessionKey(), k -> new ArrayList<>());
            synchronized (history) {
                history.add(workLog);
            }
            restored++;
        }
        for (List<WorkLog> history : bySession.values()) {
            synchronized (history) {
                history.sort(OPEN_ORDER);
                evictSealed(history);
            }
        }
        log.info("Work log index ready: {} restored, {} sessions", restored, bySession.size());
    }

    public WorkLogHandle open(String sessionKey, RoomDto room) {
        return open(sessionKey, room, null);
    }

    /**
     * Opens a new log for the session. The room's id, type and participants are copied now;
     * later changes to the room do not reach this log.
     */
    public WorkLogHandle open(String sessionKey, RoomDto room, String query) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException("sessionKey is required");
        }
        Objects.requireNonNull(room, "room");

        WorkLog workLog = new WorkLog(UUID.randomUUID().toString(), sessionKey, query,
                RoomContext.of(room), clock.instant(), openCounter.incrementAndGet());
        logsById.put(workLog.getLogId(), workLog);

        while (true) {
            List<WorkLog> history = bySession.computeIfAbsent(sessionKey, k -> new ArrayList<>());
            synchronized (history) {
                // endSession may have unmapped this list after we fetched it
                if (bySession.get(sessionKey) != history) continue;
                history.add(workLog);
                evictSealed(history);
                break;
            }
        }
        log.debug("Opened work log {} for session {} in room '{}'", workLog.getLogId(), sessionKey, room.id());
        return workLog.handle();
    }

    /**
     * Appends an entry, assigning the next sequence number.
     *
     * @throws SealedLogException if the log is sealed
     * @throws WorkLogNotFoundException if the handle is unknown
     */
    public LogEntry append(WorkLogHandle handle, LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        WorkLog workLog = get(handle);
        LogEntry appended = workLog.append(entry, clock.instant());
        log.debug("Work log {} #{} {} {}", workLog.getLogId(), appended.sequence(), appended.level(),
                appended.message());
        return appended;
    }

    public void seal(WorkLogHandle handle) {
        seal(handle, null);
    }

    /**
     * Seals the log and stores it. Sealing an already sealed log is a no-op and keeps the first
     * final output. If the store fails the log stays open.
     */
    public void seal(WorkLogHandle handle, String finalOutput) {
        WorkLog workLog = get(handle);
        if (workLog.seal(finalOutput, clock.instant(), dto -> repository.save(WorkLogDocument.fromDto(dto)))) {
            log.info("Sealed work log {} for session {} with {} entries", workLog.getLogId(),
                    workLog.getSessionKey(), workLog.size());
        }
    }

    public WorkLog get(WorkLogHandle handle) {
        Objects.requireNonNull(handle, "handle");
        return find(handle.logId()).orElseThrow(() -> new WorkLogNotFoundException(handle.logId()));
    }

    /**
     * Looks in the index first, then in the store.
     */
    public Optional<WorkLog> find(String logId) {
        if (logId == null) return Optional.empty();
        WorkLog indexed = logsById.get(logId);
        if (indexed != null) return Optional.of(indexed);
        return repository.load(logId).map(doc -> WorkLog.restore(doc.toDto(), 0));
    }

    /**
     * Most recently opened log of the session, sealed or not.
     */
    public Optional<WorkLog> getCurrent(String sessionKey) {
        List<WorkLog> logs = getBySession(sessionKey);
        return logs.isEmpty() ? Optional.empty() : Optional.of(logs.get(logs.size() - 1));
    }

    public List<WorkLog> getBySession(String sessionKey) {
        return getBySession(sessionKey, null);
    }

    /**
     * Logs of the session in the order they were opened, optionally restricted to those
     * recorded in the given room. Covers the indexed logs and the stored ones, within the
     * per-session history limit.
     */
    public List<WorkLog> getBySession(String sessionKey, String roomFilter) {
        if (sessionKey == null) return List.of();
        Map<String, WorkLog> merged = new LinkedHashMap<>();
        for (WorkLogDocument doc : repository.loadBySession(sessionKey)) {
            merged.put(doc.getLogId(), WorkLog.restore(doc.toDto(), 0));
        }
        List<WorkLog> history = bySession.get(sessionKey);
        if (history != null) {
            synchronized (history) {
                history.forEach(w -> merged.put(w.getLogId(), w));
            }
        }
        List<WorkLog> logs = new ArrayList<>(merged.values());
        logs.sort(OPEN_ORDER);
        trimSealed(logs);
        return logs.stream()
                .filter(w -> roomFilter == null || roomFilter.equals(w.getRoomContext().roomId()))
                .toList();
    }

    public List<WorkLog> getByRoom(String roomId) {
        Map<String, WorkLog> merged = new LinkedHashMap<>();
        for (WorkLogDocument doc : repository.loadAll()) {
            if (doc.getRoomContext().roomId().equals(roomId)) {
                merged.put(doc.getLogId(), WorkLog.restore(doc.toDto(), 0));
            }
        }
        logsById.values().stream()
                .filter(w -> w.getRoomContext().roomId().equals(roomId))
                .forEach(w -> merged.put(w.getLogId(), w));
        return merged.values().stream().sorted(OPEN_ORDER).toList();
    }

    /**
     * Releases the session's sealed logs from memory. They stay in the store; logs still open
     * stay indexed until sealed and released again.
     *
     * @return number of logs released
     */
    public int endSession(String sessionKey) {
        List<WorkLog> history = sessionKey == null ? null : bySession.get(sessionKey);
        if (history == null) return 0;
        int released = 0;
        synchronized (history) {
            Iterator<WorkLog> it = history.iterator();
            while (it.hasNext()) {
                WorkLog workLog = it.next();
                if (workLog.isSealed()) {
                    it.remove();
                    logsById.remove(workLog.getLogId());
                    released++;
                }
            }
            if (history.isEmpty()) {
                bySession.remove(sessionKey, history);
            }
        }
        log.info("Released {} work log(s) of session {}", released, sessionKey);
        return released;
    }

    /**
     * Deletes stored logs started more than the retention period ago and drops sealed ones
     * from the index. Open logs are never touched.
     *
     * @return number of stored logs deleted
     */
    public int cleanup() {
        Instant cutoff = clock.instant().minus(retention);
        int deleted = repository.deleteStartedBefore(cutoff);
        int dropped = 0;
        for (Map.Entry<String, List<WorkLog>> e : bySession.entrySet()) {
            List<WorkLog> history = e.getValue();
            synchronized (history) {
                Iterator<WorkLog> it = history.iterator();
                while (it.hasNext()) {
                    WorkLog workLog = it.next();
                    if (workLog.isSealed() && workLog.getStartedAt().isBefore(cutoff)) {
                        it.remove();
                        logsById.remove(workLog.getLogId());
                        dropped++;
                    }
                }
                if (history.isEmpty()) {
                    bySession.remove(e.getKey(), history);
                }
            }
        }
        if (deleted > 0 || dropped > 0) {
            log.info("Work log cleanup before {}: {} deleted from store, {} dropped from index",
                    cutoff, deleted, dropped);
        }
        return deleted;
    }

    @Scheduled(cron = "${crewroom.worklog.cleanup-cron:0 0 3 * * *}")
    public void scheduledCleanup() {
        log.debug("Running scheduled work log cleanup");
        cleanup();
    }

    int indexedLogCount() {
        return logsById.size();
    }

    int indexedSessionCount() {
        return bySession.size();
    }

    private void evictSealed(List<WorkLog> history) {
        Iterator<WorkLog> it = history.iterator();
        while (history.size() > maxHistoryPerSession && it.hasNext()) {
            WorkLog oldest = it.next();
            if (oldest.isSealed()) {
                it.remove();
                logsById.remove(oldest.getLogId());
                log.debug("Evicted work log {} from session {}", oldest.getLogId(), oldest.getSessionKey());
            }
        }
    }

    private void trimSealed(List<WorkLog> logs) {
        Iterator<WorkLog> it = logs.iterator();
        while (logs.size() > maxHistoryPerSession && it.hasNext()) {
            if (it.next().isSealed()) it.remove();
        }
    }
}
