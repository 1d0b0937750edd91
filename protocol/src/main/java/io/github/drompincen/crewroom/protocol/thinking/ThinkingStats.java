package io.github.drompincen.crewroom.protocol.thinking;

public record ThinkingStats(
        int totalSteps,
        int decisions,
        int tools,
        int corrections,
        int errors,
        int coordination,
        long totalDurationMs
) {

    public String footer() {
        return "[" + totalSteps + " steps • " + decisions + " decisions • " + tools + " tools]";
    }
}
