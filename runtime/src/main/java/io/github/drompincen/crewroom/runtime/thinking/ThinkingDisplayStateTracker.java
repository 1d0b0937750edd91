package io.github.drompincen.crewroom.runtime.thinking;

import io.github.drompincen.crewroom.protocol.thinking.DisplayStateStats;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingDisplayMode;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingDisplayState;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Remembers, for one session, whether each message's thinking display was expanded.
 * Changing the mode never discards per-message state.
 */
public class ThinkingDisplayStateTracker {

    private final Map<Integer, ThinkingDisplayState> states = new HashMap<>();
    private final boolean defaultExpanded;
    private ThinkingDisplayMode mode;
    private Boolean globalPreference;   // USER_CHOICE only: fixed by the first toggle

    public ThinkingDisplayStateTracker() {
        this(ThinkingDisplayMode.REMEMBER_STATE);
    }

    public ThinkingDisplayStateTracker(ThinkingDisplayMode mode) {
        this(mode, false);
    }

    public ThinkingDisplayStateTracker(ThinkingDisplayMode mode, boolean defaultExpanded) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.defaultExpanded = defaultExpanded;
    }

    public synchronized boolean shouldBeExpanded(int messageIndex) {
        checkIndex(messageIndex);
        return switch (mode) {
            case ALWAYS_EXPANDED -> true;
            case ALWAYS_COLLAPSED -> false;
            case REMEMBER_STATE -> {
                ThinkingDisplayState state = states.get(messageIndex);
                yield state != null ? state.expanded() : defaultExpanded;
            }
            case USER_CHOICE -> globalPreference != null ? globalPreference : defaultExpanded;
        };
    }

    /**
     * Records the state a user left a message's display in and counts the visit. In the
     * ALWAYS_* modes only the visit is counted.
     */
    public synchronized ThinkingDisplayState recordState(int messageIndex, boolean expanded) {
        checkIndex(messageIndex);
        ThinkingDisplayState current = states.getOrDefault(messageIndex, ThinkingDisplayState.initial(messageIndex));
        boolean remembered = switch (mode) {
            case ALWAYS_EXPANDED, ALWAYS_COLLAPSED -> current.expanded();
            case REMEMBER_STATE, USER_CHOICE -> expanded;
        };
        ThinkingDisplayState updated = current.visited(remembered);
        states.put(messageIndex, updated);

        if (mode == ThinkingDisplayMode.USER_CHOICE && globalPreference == null) {
            globalPreference = expanded;
        }
        return updated;
    }

    public synchronized Optional<ThinkingDisplayState> getState(int messageIndex) {
        return Optional.ofNullable(states.get(messageIndex));
    }

    public synchronized Map<Integer, ThinkingDisplayState> getAllStates() {
        return Collections.unmodifiableMap(new TreeMap<>(states));
    }

    public synchronized void resetMessageState(int messageIndex) {
        states.remove(messageIndex);
    }

    public synchronized void resetAll() {
        states.clear();
        globalPreference = null;
    }

    /**
     * Switches mode. Leaving a mode clears the USER_CHOICE preference; per-message state stays.
     */
    public synchronized void setMode(ThinkingDisplayMode newMode) {
        Objects.requireNonNull(newMode, "mode");
        if (newMode != mode) {
            globalPreference = null;
            mode = newMode;
        }
    }

    public synchronized ThinkingDisplayMode getMode() {
        return mode;
    }

    public synchronized DisplayStateStats getStats() {
        int total = states.size();
        int expanded = (int) states.values().stream().filter(ThinkingDisplayState::expanded).count();
        int visits = states.values().stream().mapToInt(ThinkingDisplayState::visitCount).sum();
        return new DisplayStateStats(total, expanded, total - expanded, visits,
                total > 0 ? (double) visits / total : 0.0, mode, globalPreference);
    }

    private static void checkIndex(int messageIndex) {
        if (messageIndex < 0) {
            throw new IllegalArgumentException("message index must not be negative: " + messageIndex);
        }
    }
}
