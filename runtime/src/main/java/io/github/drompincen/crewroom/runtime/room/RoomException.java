package io.github.drompincen.crewroom.runtime.room;

/**
 * Base type for room lifecycle failures. Messages are safe to show to a user.
 */
public abstract class RoomException extends RuntimeException {

    private final String roomId;

    protected RoomException(String roomId, String message) {
        super(message);
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
