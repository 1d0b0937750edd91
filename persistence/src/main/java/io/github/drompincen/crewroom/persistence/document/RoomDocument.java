package io.github.drompincen.crewroom.persistence.document;

import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stored form of a room: one JSON record per room id.
 */
public class RoomDocument {

    private String id;
    private String name;
    private RoomType type;
    private List<String> participants = new ArrayList<>();
    private String owner;
    private Instant createdAt;
    private boolean defaultRoom;
    private long ordinal;          // creation order, assigned by the room manager

    public RoomDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public RoomType getType() { return type; }
    public void setType(RoomType type) { this.type = type; }

    public List<String> getParticipants() { return participants; }
    public void setParticipants(List<String> participants) {
        this.participants = participants != null ? new ArrayList<>(participants) : new ArrayList<>();
    }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean isDefaultRoom() { return defaultRoom; }
    public void setDefaultRoom(boolean defaultRoom) { this.defaultRoom = defaultRoom; }

    public long getOrdinal() { return ordinal; }
    public void setOrdinal(long ordinal) { this.ordinal = ordinal; }

    public RoomDocument copy() {
        RoomDocument c = new RoomDocument();
        c.id = id;
        c.name = name;
        c.type = type;
        c.participants = new ArrayList<>(participants);
        c.owner = owner;
        c.createdAt = createdAt;
        c.defaultRoom = defaultRoom;
        c.ordinal = ordinal;
        return c;
    }

    public RoomDto toDto() {
        return new RoomDto(id, name != null ? name : id, type, participants, owner, createdAt, defaultRoom);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoomDocument that)) return false;
        return defaultRoom == that.defaultRoom
                && ordinal == that.ordinal
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && type == that.type
                && Objects.equals(participants, that.participants)
                && Objects.equals(owner, that.owner)
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, participants, owner, createdAt, defaultRoom, ordinal);
    }
}
