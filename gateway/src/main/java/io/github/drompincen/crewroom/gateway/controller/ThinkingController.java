package io.github.drompincen.crewroom.gateway.controller;

import io.github.drompincen.crewroom.protocol.thinking.DisplayStateStats;
import io.github.drompincen.crewroom.protocol.thinking.RecordStateRequest;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingDisplayMode;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingDisplayState;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingView;
import io.github.drompincen.crewroom.runtime.thinking.ThinkingDisplayStateTracker;
import io.github.drompincen.crewroom.runtime.thinking.ThinkingStateRegistry;
import io.github.drompincen.crewroom.runtime.thinking.ThinkingSummaryBuilder;
import io.github.drompincen.crewroom.runtime.worklog.WorkLog;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogHandle;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions/{sessionKey}/thinking")
public class ThinkingController {

    private final ThinkingStateRegistry stateRegistry;
    private final ThinkingSummaryBuilder summaryBuilder;
    private final WorkLogManager workLogManager;

    public ThinkingController(ThinkingStateRegistry stateRegistry,
                              ThinkingSummaryBuilder summaryBuilder,
                              WorkLogManager workLogManager) {
        this.stateRegistry = stateRegistry;
        this.summaryBuilder = summaryBuilder;
        this.workLogManager = workLogManager;
    }

    /**
     * Summary line for a message, plus its detail lines when the display should be expanded.
     * Without {@code logId} the session's current log is used.
     */
    @GetMapping("/{index}")
    public ResponseEntity<ThinkingView> view(@PathVariable String sessionKey,
                                             @PathVariable int index,
                                             @RequestParam(required = false) String logId) {
        WorkLog log = logId != null
                ? workLogManager.get(new WorkLogHandle(logId))
                : workLogManager.getCurrent(sessionKey).orElse(null);
        if (log == null) return ResponseEntity.notFound().build();

        boolean expanded = stateRegistry.forSession(sessionKey).shouldBeExpanded(index);
        List<String> details = expanded ? summaryBuilder.renderExpanded(log, null) : List.of();
        return ResponseEntity.ok(new ThinkingView(index, log.getLogId(),
                summaryBuilder.generateSummary(log), expanded, details));
    }

    @PutMapping("/{index}")
    public ThinkingDisplayState record(@PathVariable String sessionKey,
                                       @PathVariable int index,
                                       @RequestBody RecordStateRequest req) {
        return stateRegistry.forSession(sessionKey).recordState(index, req.expanded());
    }

    @PutMapping("/mode")
    public DisplayStateStats setMode(@PathVariable String sessionKey, @RequestBody Map<String, String> body) {
        String mode = body.get("mode");
        if (mode == null) throw new IllegalArgumentException("mode is required");
        ThinkingDisplayStateTracker tracker = stateRegistry.forSession(sessionKey);
        tracker.setMode(ThinkingDisplayMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
        return tracker.getStats();
    }

    @GetMapping("/stats")
    public DisplayStateStats stats(@PathVariable String sessionKey) {
        return stateRegistry.forSession(sessionKey).getStats();
    }

    @DeleteMapping
    public ResponseEntity<Void> endSession(@PathVariable String sessionKey) {
        return stateRegistry.endSession(sessionKey)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
