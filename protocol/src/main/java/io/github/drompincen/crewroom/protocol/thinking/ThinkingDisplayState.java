package io.github.drompincen.crewroom.protocol.thinking;

/**
 * Disclosure state of one message's thinking display. {@code visitCount} is diagnostic only.
 */
public record ThinkingDisplayState(
        int messageIndex,
        boolean expanded,
        int visitCount
) {
    public static ThinkingDisplayState initial(int messageIndex) {
        return new ThinkingDisplayState(messageIndex, false, 0);
    }

    public ThinkingDisplayState visited(boolean nowExpanded) {
        return new ThinkingDisplayState(messageIndex, nowExpanded, visitCount + 1);
    }
}
