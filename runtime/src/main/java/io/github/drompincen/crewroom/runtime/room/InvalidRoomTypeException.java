package io.github.drompincen.crewroom.runtime.room;

import io.github.drompincen.crewroom.protocol.api.RoomType;

import java.util.Arrays;

public class InvalidRoomTypeException extends RoomException {

    public InvalidRoomTypeException(String roomId, String requestedType) {
        super(roomId, "invalid room type '" + requestedType + "', expected one of "
                + Arrays.toString(RoomType.values()));
    }
}
