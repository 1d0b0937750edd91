package io.github.drompincen.crewroom.runtime.worklog;

public class WorkLogNotFoundException extends WorkLogException {

    public WorkLogNotFoundException(String logId) {
        super(logId, "work log '" + logId + "' not found");
    }
}
