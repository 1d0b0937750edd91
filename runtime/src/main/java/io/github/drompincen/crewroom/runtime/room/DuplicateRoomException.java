package io.github.drompincen.crewroom.runtime.room;

public class DuplicateRoomException extends RoomException {

    public DuplicateRoomException(String roomId) {
        super(roomId, "room '" + roomId + "' already exists");
    }
}
