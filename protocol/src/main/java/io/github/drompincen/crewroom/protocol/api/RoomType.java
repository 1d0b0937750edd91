package io.github.drompincen.crewroom.protocol.api;

public enum RoomType {
    OPEN,
    PROJECT,
    DIRECT,
    COORDINATION;

    public static final int DIRECT_CAPACITY = 2;

    /**
     * Maximum number of participants a room of this type may hold.
     */
    public int capacity() {
        return this == DIRECT ? DIRECT_CAPACITY : Integer.MAX_VALUE;
    }
}
