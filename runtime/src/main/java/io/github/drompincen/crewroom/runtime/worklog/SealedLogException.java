package io.github.drompincen.crewroom.runtime.worklog;

public class SealedLogException extends WorkLogException {

    public SealedLogException(String logId) {
        super(logId, "work log '" + logId + "' is sealed and accepts no further entries");
    }
}
