package io.github.drompincen.crewroom.gateway.controller;

import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingStats;
import io.github.drompincen.crewroom.protocol.worklog.AppendEntryRequest;
import io.github.drompincen.crewroom.protocol.worklog.LogEntry;
import io.github.drompincen.crewroom.protocol.worklog.OpenWorkLogRequest;
import io.github.drompincen.crewroom.protocol.worklog.SealRequest;
import io.github.drompincen.crewroom.protocol.worklog.WorkLogDto;
import io.github.drompincen.crewroom.runtime.room.RoomCommandService;
import io.github.drompincen.crewroom.runtime.thinking.ThinkingSummaryBuilder;
import io.github.drompincen.crewroom.runtime.worklog.WorkLog;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogHandle;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/worklogs")
public class WorkLogController {

    private final WorkLogManager workLogManager;
    private final RoomCommandService roomCommandService;
    private final ThinkingSummaryBuilder summaryBuilder;

    public WorkLogController(WorkLogManager workLogManager,
                             RoomCommandService roomCommandService,
                             ThinkingSummaryBuilder summaryBuilder) {
        this.workLogManager = workLogManager;
        this.roomCommandService = roomCommandService;
        this.summaryBuilder = summaryBuilder;
    }

    @PostMapping
    public ResponseEntity<WorkLogDto> open(@RequestBody OpenWorkLogRequest req) {
        RoomDto room = roomCommandService.resolveRoom(req.sessionKey(), req.roomId());
        WorkLogHandle handle = workLogManager.open(req.sessionKey(), room, req.query());
        return ResponseEntity.status(201).body(workLogManager.get(handle).toDto());
    }

    @PostMapping("/{logId}/entries")
    public LogEntry append(@PathVariable String logId, @RequestBody AppendEntryRequest req) {
        return workLogManager.append(new WorkLogHandle(logId), req.toEntry());
    }

    @PostMapping("/{logId}/seal")
    public WorkLogDto seal(@PathVariable String logId, @RequestBody(required = false) SealRequest req) {
        WorkLogHandle handle = new WorkLogHandle(logId);
        workLogManager.seal(handle, req != null ? req.finalOutput() : null);
        return workLogManager.get(handle).toDto();
    }

    @GetMapping("/{logId}")
    public WorkLogDto get(@PathVariable String logId) {
        return load(logId).toDto();
    }

    @GetMapping("/{logId}/summary")
    public Map<String, String> summary(@PathVariable String logId,
                                       @RequestParam(defaultValue = "2") int maxActions) {
        return Map.of("summary", summaryBuilder.generateSummary(load(logId), maxActions));
    }

    @GetMapping("/{logId}/details")
    public List<String> details(@PathVariable String logId,
                                @RequestParam(required = false) String bot,
                                @RequestParam(defaultValue = "false") boolean footer) {
        WorkLog log = load(logId);
        return footer ? summaryBuilder.renderExpanded(log, bot) : summaryBuilder.generateDetails(log, bot);
    }

    @GetMapping("/{logId}/stats")
    public ThinkingStats stats(@PathVariable String logId) {
        return summaryBuilder.getStats(load(logId));
    }

    @GetMapping("/sessions/{sessionKey}/current")
    public ResponseEntity<WorkLogDto> current(@PathVariable String sessionKey) {
        return workLogManager.getCurrent(sessionKey)
                .map(w -> ResponseEntity.ok(w.toDto()))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/sessions/{sessionKey}")
    public List<WorkLogDto> history(@PathVariable String sessionKey,
                                    @RequestParam(required = false) String roomId) {
        return workLogManager.getBySession(sessionKey, roomId).stream()
                .map(WorkLog::toDto)
                .toList();
    }

    private WorkLog load(String logId) {
        return workLogManager.get(new WorkLogHandle(logId));
    }
}
