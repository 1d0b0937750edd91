package io.github.drompincen.crewroom.protocol.thinking;

public enum ThinkingDisplayMode {
    ALWAYS_COLLAPSED,
    ALWAYS_EXPANDED,
    REMEMBER_STATE,
    USER_CHOICE
}
