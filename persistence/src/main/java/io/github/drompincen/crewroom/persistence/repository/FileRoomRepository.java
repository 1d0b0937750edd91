package io.github.drompincen.crewroom.persistence.repository;

import io.github.drompincen.crewroom.persistence.PersistenceException;
import io.github.drompincen.crewroom.persistence.document.RoomDocument;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stores each room as {@code <dir>/<id>.json}. Records that break a room invariant (wrong id,
 * no type, no participants, a DIRECT room over capacity) are reported as corrupt.
 */
public class FileRoomRepository implements RoomRepository {

    private final JsonFileStore store;

    public FileRoomRepository(Path directory) {
        this.store = new JsonFileStore(directory, "room");
    }

    public Path getDirectory() {
        return store.directory();
    }

    @Override
    public RoomDocument save(RoomDocument room) {
        store.write(room.getId(), room);
        return room;
    }

    @Override
    public Optional<RoomDocument> load(String id) {
        Path file = store.fileFor(id);
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(read(file));
    }

    @Override
    public List<RoomDocument> loadAll() {
        List<RoomDocument> rooms = new ArrayList<>();
        for (Path file : store.list()) {
            rooms.add(read(file));
        }
        rooms.sort(Comparator.comparingLong(RoomDocument::getOrdinal).thenComparing(RoomDocument::getId));
        return rooms;
    }

    @Override
    public boolean exists(String id) {
        return Files.exists(store.fileFor(id));
    }

    private RoomDocument read(Path file) {
        RoomDocument room = store.read(file, RoomDocument.class);
        if (room.getId() == null || !room.getId().equals(JsonFileStore.idOf(file)) || room.getType() == null) {
            throw new PersistenceException("Corrupt room record " + file + ": id/type mismatch");
        }
        if (room.getParticipants().isEmpty()) {
            throw new PersistenceException("Corrupt room record " + file + ": no participants");
        }
        if (room.getParticipants().size() > room.getType().capacity()) {
            throw new PersistenceException("Corrupt room record " + file + ": " + room.getType()
                    + " room holds " + room.getParticipants().size() + " participants, capacity is "
                    + room.getType().capacity());
        }
        return room;
    }
}
