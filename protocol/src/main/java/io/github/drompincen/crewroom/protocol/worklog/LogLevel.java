package io.github.drompincen.crewroom.protocol.worklog;

public enum LogLevel {
    DECISION,
    TOOL,
    CORRECTION,
    ERROR,
    COORDINATION
}
