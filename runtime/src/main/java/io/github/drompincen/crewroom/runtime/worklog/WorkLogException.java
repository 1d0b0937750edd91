package io.github.drompincen.crewroom.runtime.worklog;

public abstract class WorkLogException extends RuntimeException {

    private final String logId;

    protected WorkLogException(String logId, String message) {
        super(message);
        this.logId = logId;
    }

    public String getLogId() {
        return logId;
    }
}
