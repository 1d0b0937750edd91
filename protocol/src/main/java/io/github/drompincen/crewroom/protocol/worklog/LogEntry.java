package io.github.drompincen.crewroom.protocol.worklog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One step recorded in a work log. Entries built by the factories are unsequenced drafts;
 * the work log manager assigns {@code sequence} and {@code timestamp} when it appends them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
        long sequence,
        LogLevel level,
        String message,
        String botName,
        String toolName,
        String result,
        Long durationMs,
        Double confidence,
        boolean escalation,
        Instant timestamp
) {
    public static final String ESCALATION_PREFIX = "Escalation: ";

    public LogEntry {
        if (level == null) throw new IllegalArgumentException("level is required");
        if (message == null) message = "";
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be within 0.0-1.0, was " + confidence);
        }
    }

    public static LogEntry of(LogLevel level, String message) {
        return new LogEntry(0, level, message, null, null, null, null, null, false, null);
    }

    public static LogEntry decision(String message, Double confidence) {
        return new LogEntry(0, LogLevel.DECISION, message, null, null, null, null, confidence, false, null);
    }

    public static LogEntry decision(String message) {
        return decision(message, null);
    }

    public static LogEntry tool(String toolName, String result, Long durationMs) {
        return new LogEntry(0, LogLevel.TOOL, "Executed " + toolName, null, toolName, result, durationMs,
                null, false, null);
    }

    public static LogEntry correction(String message) {
        return of(LogLevel.CORRECTION, message);
    }

    public static LogEntry error(String message) {
        return of(LogLevel.ERROR, message);
    }

    public static LogEntry coordination(String message) {
        return of(LogLevel.COORDINATION, message);
    }

    public static LogEntry escalation(String reason) {
        return new LogEntry(0, LogLevel.COORDINATION, ESCALATION_PREFIX + reason, null, null, null, null,
                null, true, null);
    }

    public LogEntry byBot(String bot) {
        return new LogEntry(sequence, level, message, bot, toolName, result, durationMs, confidence,
                escalation, timestamp);
    }

    public LogEntry sequenced(long seq, Instant at) {
        return new LogEntry(seq, level, message, botName, toolName, result, durationMs, confidence,
                escalation, at);
    }

    @JsonIgnore
    public boolean isToolEntry() {
        return level == LogLevel.TOOL;
    }
}
