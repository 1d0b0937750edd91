package io.github.drompincen.crewroom.runtime.room;

import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomIntent;
import io.github.drompincen.crewroom.protocol.api.RoomType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Caller-side policy on top of {@link RoomManager}: falls back to the default room for unknown
 * references and turns a validated {@link RoomIntent} into create/invite/focus calls.
 */
@Service
public class RoomCommandService {

    private static final Logger log = LoggerFactory.getLogger(RoomCommandService.class);

    private final RoomManager roomManager;

    public RoomCommandService(RoomManager roomManager) {
        this.roomManager = roomManager;
    }

    /**
     * Explicit known id wins; an unknown id falls back to the default room; no id means the
     * session's focused room, or the default room when the session has none.
     */
    public RoomDto resolveRoom(String sessionKey, String requestedRoomId) {
        if (requestedRoomId != null && !requestedRoomId.isBlank()) {
            Optional<RoomDto> room = roomManager.getRoom(requestedRoomId);
            if (room.isPresent()) {
                return room.get();
            }
            log.warn("Room '{}' not found for session {}, using default room", requestedRoomId, sessionKey);
            return roomManager.getDefaultRoom();
        }
        if (sessionKey != null && !sessionKey.isBlank()) {
            Optional<RoomDto> focused = roomManager.currentRoom(sessionKey);
            if (focused.isPresent()) {
                return focused.get();
            }
        }
        return roomManager.getDefaultRoom();
    }

    public RoomDto applyIntent(String sessionKey, RoomIntent intent) {
        validate(intent);

        RoomDto room;
        if (intent.shouldCreateRoom()) {
            room = createOrReuse(intent);
        } else {
            room = resolveRoom(sessionKey, null);
        }

        for (RoomIntent.Recommendation rec : intent.recommendedParticipants()) {
            room = roomManager.inviteParticipant(room.id(), rec.name());
            log.debug("Invited '{}' to '{}' ({})", rec.name(), room.id(), rec.reason());
        }

        if (intent.shouldCreateRoom() && sessionKey != null && !sessionKey.isBlank()) {
            room = roomManager.switchFocus(sessionKey, room.id());
        }
        return room;
    }

    private RoomDto createOrReuse(RoomIntent intent) {
        String roomId = RoomManager.normalizeId(intent.roomName());
        Optional<RoomDto> existing = roomManager.getRoom(roomId);
        if (existing.isPresent()) {
            log.info("Room '{}' already exists, reusing it", roomId);
            return existing.get();
        }
        try {
            return roomManager.createRoom(roomId, intent.roomName(), intent.roomType(), List.of());
        } catch (DuplicateRoomException e) {
            // created concurrently between the lookup and the create
            return roomManager.getRoom(roomId).orElseThrow(() -> e);
        }
    }

    static void validate(RoomIntent intent) {
        if (intent == null) {
            throw new IllegalArgumentException("intent is required");
        }
        if (intent.shouldCreateRoom()) {
            if (intent.roomName() == null || intent.roomName().isBlank()) {
                throw new IllegalArgumentException("intent to create a room needs a room name");
            }
            if (intent.roomType() == null) {
                throw new IllegalArgumentException("intent to create a room needs a room type");
            }
            if (intent.roomType() == RoomType.DIRECT && intent.recommendedParticipants().size() > 1) {
                throw new IllegalArgumentException("a DIRECT room takes exactly one invited participant, got "
                        + intent.recommendedParticipants().size());
            }
        }
        for (RoomIntent.Recommendation rec : intent.recommendedParticipants()) {
            if (rec == null || rec.name() == null || rec.name().isBlank()) {
                throw new IllegalArgumentException("every recommended participant needs a name");
            }
        }
    }
}
