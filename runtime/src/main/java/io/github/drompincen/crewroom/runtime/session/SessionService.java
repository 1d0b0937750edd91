package io.github.drompincen.crewroom.runtime.session;

import io.github.drompincen.crewroom.runtime.room.RoomManager;
import io.github.drompincen.crewroom.runtime.thinking.ThinkingStateRegistry;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Releases everything held in memory for a session once it ends: room focus, sealed work
 * logs and thinking display state. Rooms and stored work logs are kept.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final RoomManager roomManager;
    private final WorkLogManager workLogManager;
    private final ThinkingStateRegistry thinkingStateRegistry;

    public SessionService(RoomManager roomManager, WorkLogManager workLogManager,
                          ThinkingStateRegistry thinkingStateRegistry) {
        this.roomManager = roomManager;
        this.workLogManager = workLogManager;
        this.thinkingStateRegistry = thinkingStateRegistry;
    }

    public void endSession(String sessionKey) {
        roomManager.clearFocus(sessionKey);
        int released = workLogManager.endSession(sessionKey);
        boolean hadDisplayState = thinkingStateRegistry.endSession(sessionKey);
        log.info("Ended session {}: {} work log(s) released, display state {}", sessionKey, released,
                hadDisplayState ? "dropped" : "absent");
    }
}
