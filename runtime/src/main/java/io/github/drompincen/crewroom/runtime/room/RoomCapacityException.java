package io.github.drompincen.crewroom.runtime.room;

import io.github.drompincen.crewroom.protocol.api.RoomType;

public class RoomCapacityException extends RoomException {

    public RoomCapacityException(String roomId, RoomType type, int capacity) {
        super(roomId, "room '" + roomId + "' is a " + type + " room and cannot hold more than " + capacity
                + " participants");
    }
}
