package io.github.drompincen.crewroom.gateway;

import io.github.drompincen.crewroom.gateway.controller.RoomController;
import io.github.drompincen.crewroom.protocol.api.RoomSummary;
import io.github.drompincen.crewroom.runtime.room.RoomManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "crewroom.data-dir=${java.io.tmpdir}/crewroom-test-${random.uuid}",
        "crewroom.coordinator-id=captain"
})
class CrewRoomApplicationTest {

    @Autowired private RoomManager roomManager;
    @Autowired private RoomController roomController;

    @Test
    void contextStartsWithDefaultRoom() {
        assertThat(roomManager.isInitialized()).isTrue();
        assertThat(roomController.list()).extracting(RoomSummary::id).containsExactly("general");
        assertThat(roomManager.getDefaultRoom().participants()).containsExactly("captain");
    }
}
