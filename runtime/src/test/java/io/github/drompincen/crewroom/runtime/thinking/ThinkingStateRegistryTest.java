package io.github.drompincen.crewroom.runtime.thinking;

import io.github.drompincen.crewroom.protocol.thinking.ThinkingDisplayMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThinkingStateRegistryTest {

    private final ThinkingStateRegistry registry = new ThinkingStateRegistry(ThinkingDisplayMode.ALWAYS_EXPANDED);

    @Test
    void sessionsGetTheirOwnTracker() {
        ThinkingDisplayStateTracker s1 = registry.forSession("s1");
        ThinkingDisplayStateTracker s2 = registry.forSession("s2");

        s1.setMode(ThinkingDisplayMode.ALWAYS_COLLAPSED);

        assertThat(registry.forSession("s1")).isSameAs(s1);
        assertThat(s2.getMode()).isEqualTo(ThinkingDisplayMode.ALWAYS_EXPANDED);
        assertThat(registry.activeSessions()).isEqualTo(2);
    }

    @Test
    void endSessionDropsState() {
        registry.forSession("s1").recordState(0, true);

        assertThat(registry.endSession("s1")).isTrue();
        assertThat(registry.endSession("s1")).isFalse();
        assertThat(registry.find("s1")).isEmpty();
    }

    @Test
    void blankSessionKeyIsRejected() {
        assertThatThrownBy(() -> registry.forSession(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.find(null)).isEmpty();
    }
}
