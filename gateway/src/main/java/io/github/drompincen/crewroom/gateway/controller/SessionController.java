package io.github.drompincen.crewroom.gateway.controller;

import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomIntent;
import io.github.drompincen.crewroom.protocol.api.SwitchFocusRequest;
import io.github.drompincen.crewroom.runtime.room.RoomCommandService;
import io.github.drompincen.crewroom.runtime.room.RoomManager;
import io.github.drompincen.crewroom.runtime.session.SessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Session-scoped room state: which room a session is focused on, and intent application.
 */
@RestController
@RequestMapping("/api/sessions/{sessionKey}")
public class SessionController {

    private final RoomManager roomManager;
    private final RoomCommandService roomCommandService;
    private final SessionService sessionService;

    public SessionController(RoomManager roomManager, RoomCommandService roomCommandService,
                             SessionService sessionService) {
        this.roomManager = roomManager;
        this.roomCommandService = roomCommandService;
        this.sessionService = sessionService;
    }

    @DeleteMapping
    public ResponseEntity<Void> endSession(@PathVariable String sessionKey) {
        sessionService.endSession(sessionKey);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/focus")
    public RoomDto switchFocus(@PathVariable String sessionKey, @RequestBody SwitchFocusRequest req) {
        return roomManager.switchFocus(sessionKey, req.roomId());
    }

    // Falls back to the default room when the session has no focus.
    @GetMapping("/focus")
    public RoomDto currentRoom(@PathVariable String sessionKey) {
        return roomCommandService.resolveRoom(sessionKey, null);
    }

    @DeleteMapping("/focus")
    public ResponseEntity<Void> clearFocus(@PathVariable String sessionKey) {
        roomManager.clearFocus(sessionKey);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/intent")
    public RoomDto applyIntent(@PathVariable String sessionKey, @RequestBody RoomIntent intent) {
        return roomCommandService.applyIntent(sessionKey, intent);
    }
}
