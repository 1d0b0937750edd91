package io.github.drompincen.crewroom.runtime.thinking;

import io.github.drompincen.crewroom.protocol.thinking.ThinkingDisplayMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One display-state tracker per interactive session, in memory only.
 */
@Component
public class ThinkingStateRegistry {

    private static final Logger log = LoggerFactory.getLogger(ThinkingStateRegistry.class);

    private final Map<String, ThinkingDisplayStateTracker> trackers = new ConcurrentHashMap<>();
    private final ThinkingDisplayMode defaultMode;

    public ThinkingStateRegistry(@Value("${crewroom.thinking.default-mode:REMEMBER_STATE}") ThinkingDisplayMode defaultMode) {
        this.defaultMode = defaultMode;
    }

    public ThinkingDisplayStateTracker forSession(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException("sessionKey is required");
        }
        return trackers.computeIfAbsent(sessionKey, k -> {
            log.debug("Tracking thinking display state for session {} in {} mode", k, defaultMode);
            return new ThinkingDisplayStateTracker(defaultMode);
        });
    }

    public Optional<ThinkingDisplayStateTracker> find(String sessionKey) {
        return sessionKey == null ? Optional.empty() : Optional.ofNullable(trackers.get(sessionKey));
    }

    /**
     * Discards the session's display state.
     *
     * @return true if the session had state
     */
    public boolean endSession(String sessionKey) {
        return sessionKey != null && trackers.remove(sessionKey) != null;
    }

    public int activeSessions() {
        return trackers.size();
    }
}
