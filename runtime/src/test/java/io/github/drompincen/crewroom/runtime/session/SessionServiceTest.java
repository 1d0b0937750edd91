package io.github.drompincen.crewroom.runtime.session;

import io.github.drompincen.crewroom.persistence.repository.FileRoomRepository;
import io.github.drompincen.crewroom.persistence.repository.FileWorkLogRepository;
import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingDisplayMode;
import io.github.drompincen.crewroom.protocol.worklog.LogEntry;
import io.github.drompincen.crewroom.runtime.room.RoomManager;
import io.github.drompincen.crewroom.runtime.thinking.ThinkingStateRegistry;
import io.github.drompincen.crewroom.runtime.worklog.WorkLog;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogHandle;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionServiceTest {

    @TempDir
    Path dir;

    private RoomManager roomManager;
    private WorkLogManager workLogManager;
    private ThinkingStateRegistry registry;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        roomManager = new RoomManager(new FileRoomRepository(dir.resolve("rooms")));
        roomManager.initialize();
        workLogManager = new WorkLogManager(new FileWorkLogRepository(dir.resolve("worklogs")));
        workLogManager.initialize();
        registry = new ThinkingStateRegistry(ThinkingDisplayMode.REMEMBER_STATE);
        sessionService = new SessionService(roomManager, workLogManager, registry);
    }

    @Test
    void endSessionDropsFocusDisplayStateAndSealedLogs() {
        RoomDto launch = roomManager.createRoom("launch", "project", List.of("coder"));
        roomManager.switchFocus("s1", "launch");
        WorkLogHandle h = workLogManager.open("s1", launch, "ship it");
        workLogManager.append(h, LogEntry.decision("delegate"));
        workLogManager.seal(h, "shipped");
        registry.forSession("s1").recordState(1, true);

        sessionService.endSession("s1");

        assertThat(roomManager.currentRoom("s1")).isEmpty();
        assertThat(registry.find("s1")).isEmpty();
        // released from memory, still in the store
        assertThat(workLogManager.getBySession("s1")).extracting(WorkLog::getLogId).containsExactly(h.logId());
        assertThat(roomManager.getRoom("launch")).isPresent();
    }

    @Test
    void otherSessionsAreUntouched() {
        roomManager.switchFocus("s1", "general");
        roomManager.switchFocus("s2", "general");
        registry.forSession("s2");

        sessionService.endSession("s1");

        assertThat(roomManager.currentRoom("s2")).map(RoomDto::id).contains("general");
        assertThat(registry.find("s2")).isPresent();
    }

    @Test
    void endingUnknownSessionIsHarmless() {
        sessionService.endSession("never-seen");

        assertThat(registry.activeSessions()).isZero();
    }

    @Test
    void blankSessionKeyIsRejected() {
        assertThatThrownBy(() -> sessionService.endSession(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
