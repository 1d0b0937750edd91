package io.github.drompincen.crewroom.persistence.repository;

import io.github.drompincen.crewroom.persistence.document.RoomDocument;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of room records keyed by id. Implementations write whole records atomically:
 * a reader sees either the previous record or the new one, never a partial write.
 */
public interface RoomRepository {

    RoomDocument save(RoomDocument room);

    Optional<RoomDocument> load(String id);

    List<RoomDocument> loadAll();

    boolean exists(String id);
}
