package io.github.drompincen.crewroom.persistence.repository;

import io.github.drompincen.crewroom.persistence.PersistenceException;
import io.github.drompincen.crewroom.persistence.document.WorkLogDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stores each sealed work log as {@code <dir>/<logId>.json}.
 */
public class FileWorkLogRepository implements WorkLogRepository {

    private static final Logger log = LoggerFactory.getLogger(FileWorkLogRepository.class);

    private static final Comparator<WorkLogDocument> OLDEST_FIRST =
            Comparator.comparing(WorkLogDocument::getStartedAt).thenComparing(WorkLogDocument::getLogId);

    private final JsonFileStore store;

    public FileWorkLogRepository(Path directory) {
        this.store = new JsonFileStore(directory, "work log");
    }

    public Path getDirectory() {
        return store.directory();
    }

    @Override
    public WorkLogDocument save(WorkLogDocument workLog) {
        if (workLog.getSealedAt() == null) {
            throw new IllegalArgumentException("work log '" + workLog.getLogId() + "' is not sealed");
        }
        store.write(workLog.getLogId(), workLog);
        return workLog;
    }

    @Override
    public Optional<WorkLogDocument> load(String logId) {
        if (!JsonFileStore.isValidId(logId)) return Optional.empty();
        Path file = store.fileFor(logId);
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(read(file));
    }

    @Override
    public List<WorkLogDocument> loadAll() {
        List<WorkLogDocument> logs = new ArrayList<>();
        for (Path file : store.list()) {
            logs.add(read(file));
        }
        logs.sort(OLDEST_FIRST);
        return logs;
    }

    @Override
    public List<WorkLogDocument> loadBySession(String sessionKey) {
        return loadAll().stream()
                .filter(doc -> doc.getSessionKey().equals(sessionKey))
                .toList();
    }

    @Override
    public int deleteStartedBefore(Instant cutoff) {
        int deleted = 0;
        for (Path file : store.list()) {
            if (read(file).getStartedAt().isBefore(cutoff)) {
                store.delete(file);
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Deleted {} work log(s) started before {}", deleted, cutoff);
        }
        return deleted;
    }

    private WorkLogDocument read(Path file) {
        WorkLogDocument doc = store.read(file, WorkLogDocument.class);
        if (doc.getLogId() == null || !doc.getLogId().equals(JsonFileStore.idOf(file))) {
            throw new PersistenceException("Corrupt work log record " + file + ": id mismatch");
        }
        if (doc.getSessionKey() == null || doc.getRoomContext() == null
                || doc.getStartedAt() == null || doc.getSealedAt() == null) {
            throw new PersistenceException("Corrupt work log record " + file + ": missing session, room or timestamps");
        }
        return doc;
    }
}
