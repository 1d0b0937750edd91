package io.github.drompincen.crewroom.persistence.repository;

import io.github.drompincen.crewroom.persistence.PersistenceException;
import io.github.drompincen.crewroom.persistence.document.RoomDocument;
import io.github.drompincen.crewroom.protocol.api.RoomType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileRoomRepositoryTest {

    @TempDir
    Path dir;

    private FileRoomRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileRoomRepository(dir.resolve("rooms"));
    }

    private static RoomDocument room(String id, RoomType type, long ordinal, String... participants) {
        RoomDocument doc = new RoomDocument();
        doc.setId(id);
        doc.setName(id);
        doc.setType(type);
        doc.setParticipants(List.of(participants));
        doc.setOwner("user");
        doc.setCreatedAt(Instant.parse("2026-03-01T10:00:00Z"));
        doc.setOrdinal(ordinal);
        return doc;
    }

    @Test
    void saveThenLoadReturnsSameRecord() {
        RoomDocument doc = room("launch", RoomType.PROJECT, 1, "leader", "coder");

        repository.save(doc);

        assertThat(repository.load("launch")).contains(doc);
        assertThat(repository.exists("launch")).isTrue();
        assertThat(Files.exists(repository.getDirectory().resolve("launch.json"))).isTrue();
    }

    @Test
    void loadMissingIsEmpty() {
        assertThat(repository.load("nope")).isEmpty();
        assertThat(repository.exists("nope")).isFalse();
    }

    @Test
    void saveOverwritesAndLeavesNoTempFiles() throws IOException {
        RoomDocument doc = room("dm", RoomType.DIRECT, 1, "alice");
        repository.save(doc);
        doc.getParticipants().add("bob");
        repository.save(doc);

        assertThat(repository.load("dm").orElseThrow().getParticipants()).containsExactly("alice", "bob");
        try (Stream<Path> files = Files.list(repository.getDirectory())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("dm.json");
        }
    }

    @Test
    void loadAllOrdersByOrdinal() {
        repository.save(room("zeta", RoomType.OPEN, 1, "leader"));
        repository.save(room("alpha", RoomType.OPEN, 3, "leader"));
        repository.save(room("mid", RoomType.OPEN, 2, "leader"));

        assertThat(repository.loadAll()).extracting(RoomDocument::getId)
                .containsExactly("zeta", "mid", "alpha");
    }

    @Test
    void loadAllSkipsLeftoverTempFiles() throws IOException {
        repository.save(room("launch", RoomType.PROJECT, 1, "leader"));
        Files.writeString(repository.getDirectory().resolve(".launch.abc.tmp"), "{garbage");
        Files.writeString(repository.getDirectory().resolve(".hidden.json"), "{garbage");

        assertThat(repository.loadAll()).extracting(RoomDocument::getId).containsExactly("launch");
    }

    @Test
    void corruptRecordFailsLoud() throws IOException {
        Files.writeString(repository.getDirectory().resolve("broken.json"), "{not json");

        assertThatThrownBy(() -> repository.loadAll())
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("broken.json");
    }

    @Test
    void recordWhoseIdDoesNotMatchFileNameIsCorrupt() throws IOException {
        repository.save(room("launch", RoomType.PROJECT, 1, "leader"));
        Files.move(repository.getDirectory().resolve("launch.json"), repository.getDirectory().resolve("other.json"));

        assertThatThrownBy(() -> repository.load("other"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("mismatch");
    }

    @Test
    void roomWithoutParticipantsIsCorrupt() {
        repository.save(room("empty", RoomType.OPEN, 1));

        assertThatThrownBy(() -> repository.load("empty"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("no participants");
        assertThatThrownBy(() -> repository.loadAll())
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void directRoomOverCapacityIsCorrupt() throws IOException {
        Files.writeString(repository.getDirectory().resolve("dm.json"),
                "{\"id\": \"dm\", \"name\": \"dm\", \"type\": \"DIRECT\","
                        + " \"participants\": [\"alice\", \"bob\", \"carol\"], \"ordinal\": 1}");

        assertThatThrownBy(() -> repository.load("dm"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("capacity is 2");
    }

    @Test
    void projectRoomHasNoCapacityLimit() {
        repository.save(room("big", RoomType.PROJECT, 1, "leader", "a", "b", "c", "d"));

        assertThat(repository.load("big").orElseThrow().getParticipants()).hasSize(5);
    }

    @Test
    void rejectsIdsThatAreNotSlugs() {
        assertThatThrownBy(() -> repository.exists("../etc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repository.save(room("Bad Id", RoomType.OPEN, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
