package io.github.drompincen.crewroom.runtime.worklog;

public record WorkLogHandle(String logId) {

    public WorkLogHandle {
        if (logId == null || logId.isBlank()) {
            throw new IllegalArgumentException("logId is required");
        }
    }
}
