package io.github.drompincen.crewroom.protocol.thinking;

public record DisplayStateStats(
        int totalTracked,
        int expandedCount,
        int collapsedCount,
        int totalVisits,
        double averageVisits,
        ThinkingDisplayMode currentMode,
        Boolean globalPreference
) {}
