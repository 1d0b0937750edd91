package io.github.drompincen.crewroom.persistence.repository;

import io.github.drompincen.crewroom.persistence.document.WorkLogDocument;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of sealed work logs keyed by log id.
 */
public interface WorkLogRepository {

    WorkLogDocument save(WorkLogDocument workLog);

    /**
     * Empty for unknown ids and for ids that could never have been issued.
     */
    Optional<WorkLogDocument> load(String logId);

    /**
     * Every stored log, oldest start first.
     */
    List<WorkLogDocument> loadAll();

    List<WorkLogDocument> loadBySession(String sessionKey);

    /**
     * Deletes logs started before {@code cutoff}.
     *
     * @return number of logs deleted
     */
    int deleteStartedBefore(Instant cutoff);
}
