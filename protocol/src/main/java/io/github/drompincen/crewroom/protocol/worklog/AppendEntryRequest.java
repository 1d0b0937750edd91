package io.github.drompincen.crewroom.protocol.worklog;

public record AppendEntryRequest(
        LogLevel level,
        String message,
        String botName,
        String toolName,
        String result,
        Long durationMs,
        Double confidence,
        boolean escalation
) {
    public LogEntry toEntry() {
        return new LogEntry(0, level, message, botName, toolName, result, durationMs, confidence, escalation, null);
    }
}
