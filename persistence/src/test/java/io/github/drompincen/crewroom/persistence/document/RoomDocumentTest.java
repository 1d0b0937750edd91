package io.github.drompincen.crewroom.persistence.document;

import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoomDocumentTest {

    @Test
    void gettersAndSettersWork() {
        RoomDocument doc = new RoomDocument();
        Instant now = Instant.now();

        doc.setId("launch");
        doc.setName("Launch");
        doc.setType(RoomType.PROJECT);
        doc.setParticipants(List.of("leader", "coder"));
        doc.setOwner("user");
        doc.setCreatedAt(now);
        doc.setDefaultRoom(false);
        doc.setOrdinal(3);

        assertThat(doc.getId()).isEqualTo("launch");
        assertThat(doc.getName()).isEqualTo("Launch");
        assertThat(doc.getType()).isEqualTo(RoomType.PROJECT);
        assertThat(doc.getParticipants()).containsExactly("leader", "coder");
        assertThat(doc.getOwner()).isEqualTo("user");
        assertThat(doc.getCreatedAt()).isEqualTo(now);
        assertThat(doc.isDefaultRoom()).isFalse();
        assertThat(doc.getOrdinal()).isEqualTo(3);
    }

    @Test
    void copyIsIndependent() {
        RoomDocument doc = new RoomDocument();
        doc.setId("dm");
        doc.setType(RoomType.DIRECT);
        doc.setParticipants(List.of("alice"));

        RoomDocument copy = doc.copy();
        copy.getParticipants().add("bob");

        assertThat(doc.getParticipants()).containsExactly("alice");
        assertThat(copy).isNotEqualTo(doc);
    }

    @Test
    void toDtoFallsBackToIdForName() {
        RoomDocument doc = new RoomDocument();
        doc.setId("general");
        doc.setType(RoomType.OPEN);
        doc.setDefaultRoom(true);

        RoomDto dto = doc.toDto();

        assertThat(dto.name()).isEqualTo("general");
        assertThat(dto.isDefault()).isTrue();
    }
}
