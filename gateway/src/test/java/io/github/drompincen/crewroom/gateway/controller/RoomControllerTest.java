package io.github.drompincen.crewroom.gateway.controller;

import io.github.drompincen.crewroom.protocol.api.CreateRoomRequest;
import io.github.drompincen.crewroom.protocol.api.InviteRequest;
import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomSummary;
import io.github.drompincen.crewroom.protocol.api.RoomType;
import io.github.drompincen.crewroom.runtime.room.RoomManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomControllerTest {

    @Mock private RoomManager roomManager;

    private RoomController controller;

    @BeforeEach
    void setUp() {
        controller = new RoomController(roomManager);
    }

    private static RoomDto room(String id, RoomType type, String... participants) {
        return new RoomDto(id, id, type, List.of(participants), "user", Instant.now(), false);
    }

    @Test
    void createReturns201() {
        when(roomManager.createRoom("launch", "project", List.of("coder")))
                .thenReturn(room("launch", RoomType.PROJECT, "leader", "coder"));

        ResponseEntity<RoomDto> response = controller.create(new CreateRoomRequest("launch", "project", List.of("coder")));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().participants()).containsExactly("leader", "coder");
    }

    @Test
    void getReturns404WhenMissing() {
        when(roomManager.getRoom("nope")).thenReturn(Optional.empty());

        assertThat(controller.get("nope").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void getReturnsRoom() {
        when(roomManager.getRoom("launch")).thenReturn(Optional.of(room("launch", RoomType.PROJECT, "leader")));

        ResponseEntity<RoomDto> response = controller.get("launch");

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().id()).isEqualTo("launch");
    }

    @Test
    void listDelegatesToManager() {
        List<RoomSummary> summaries = List.of(new RoomSummary("general", RoomType.OPEN, 1, true));
        when(roomManager.listRooms()).thenReturn(summaries);

        assertThat(controller.list()).isEqualTo(summaries);
    }

    @Test
    void inviteDelegatesToManager() {
        when(roomManager.inviteParticipant("dm", "bob")).thenReturn(room("dm", RoomType.DIRECT, "alice", "bob"));

        RoomDto updated = controller.invite("dm", new InviteRequest("bob"));

        assertThat(updated.participants()).containsExactly("alice", "bob");
        verify(roomManager).inviteParticipant("dm", "bob");
    }
}
