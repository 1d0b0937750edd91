package io.github.drompincen.crewroom.protocol.thinking;

import java.util.List;

public record ThinkingView(
        int messageIndex,
        String logId,
        String summary,
        boolean expanded,
        List<String> details
) {
    public ThinkingView {
        details = details != null ? List.copyOf(details) : List.of();
    }
}
