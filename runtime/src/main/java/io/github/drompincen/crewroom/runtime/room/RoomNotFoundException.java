package io.github.drompincen.crewroom.runtime.room;

public class RoomNotFoundException extends RoomException {

    public RoomNotFoundException(String roomId) {
        super(roomId, "room '" + roomId + "' not found");
    }
}
