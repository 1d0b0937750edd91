package io.github.drompincen.crewroom.gateway.controller;

import io.github.drompincen.crewroom.protocol.api.CreateRoomRequest;
import io.github.drompincen.crewroom.protocol.api.InviteRequest;
import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomSummary;
import io.github.drompincen.crewroom.runtime.room.RoomManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final RoomManager roomManager;

    public RoomController(RoomManager roomManager) {
        this.roomManager = roomManager;
    }

    @GetMapping
    public List<RoomSummary> list() {
        return roomManager.listRooms();
    }

    @GetMapping("/{id}")
    public ResponseEntity<RoomDto> get(@PathVariable String id) {
        return roomManager.getRoom(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<RoomDto> create(@RequestBody CreateRoomRequest req) {
        RoomDto room = roomManager.createRoom(req.id(), req.type(), req.participants());
        return ResponseEntity.status(201).body(room);
    }

    @PostMapping("/{id}/participants")
    public RoomDto invite(@PathVariable String id, @RequestBody InviteRequest req) {
        return roomManager.inviteParticipant(id, req.participantId());
    }
}
