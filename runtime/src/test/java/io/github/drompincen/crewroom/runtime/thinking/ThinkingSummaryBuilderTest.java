package io.github.drompincen.crewroom.runtime.thinking;

import io.github.drompincen.crewroom.persistence.repository.FileWorkLogRepository;
import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomType;
import io.github.drompincen.crewroom.protocol.thinking.ThinkingStats;
import io.github.drompincen.crewroom.protocol.worklog.LogEntry;
import io.github.drompincen.crewroom.protocol.worklog.LogLevel;
import io.github.drompincen.crewroom.runtime.worklog.WorkLog;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogHandle;
import io.github.drompincen.crewroom.runtime.worklog.WorkLogManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThinkingSummaryBuilderTest {

    @TempDir
    Path dir;

    private ThinkingSummaryBuilder builder;
    private WorkLogManager workLogs;
    private RoomDto room;

    @BeforeEach
    void setUp() {
        builder = new ThinkingSummaryBuilder();
        workLogs = new WorkLogManager(new FileWorkLogRepository(dir));
        room = new RoomDto("general", "General", RoomType.OPEN, List.of("leader"), "system", Instant.now(), true);
    }

    private WorkLog logOf(LogEntry... entries) {
        WorkLogHandle h = workLogs.open("s1", room);
        for (LogEntry e : entries) workLogs.append(h, e);
        workLogs.seal(h);
        return workLogs.get(h);
    }

    @Test
    void summaryUsesFirstActionsInSequenceOrder() {
        WorkLog log = logOf(
                LogEntry.decision("Delegate the pricing question"),
                LogEntry.tool("web_search", "3 hits", 210L),
                LogEntry.tool("read_file", "ok", 15L));

        assertThat(builder.generateSummary(log, 2)).isEqualTo("Delegate the pricing question, web_search");
        assertThat(builder.generateSummary(log)).isEqualTo(builder.generateSummary(log, 2));

        ThinkingStats stats = builder.getStats(log);
        assertThat(stats.decisions()).isEqualTo(1);
        assertThat(stats.tools()).isEqualTo(2);
        assertThat(stats.totalSteps()).isEqualTo(3);
        assertThat(stats.totalDurationMs()).isEqualTo(225L);
    }

    @Test
    void summaryIsDeterministic() {
        WorkLog log = logOf(LogEntry.coordination("Asked coder for a draft"), LogEntry.decision("Ship it"));

        assertThat(builder.generateSummary(log, 3)).isEqualTo(builder.generateSummary(log, 3));
        assertThat(builder.generateDetails(log)).isEqualTo(builder.generateDetails(log));
    }

    @Test
    void emptyLogHasPlaceholder() {
        assertThat(builder.generateSummary(logOf(), 2)).isEqualTo("no recorded actions");
    }

    @Test
    void errorsOnlySurfaceWithoutHigherPriorityEntries() {
        WorkLog noisy = logOf(LogEntry.error("timeout"), LogEntry.decision("Retry later"));
        WorkLog onlyErrors = logOf(LogEntry.error("timeout"), LogEntry.correction("use smaller batch"));

        assertThat(builder.generateSummary(noisy, 2)).isEqualTo("Retry later");
        assertThat(builder.generateSummary(onlyErrors, 2)).isEqualTo("failed: timeout, corrected use smaller batch");
    }

    @Test
    void longClausesAreTruncatedWithEllipsis() {
        String longText = "Compare the three vendor proposals line by line before deciding";
        WorkLog log = logOf(LogEntry.decision(longText));

        String summary = builder.generateSummary(log, 1);

        assertThat(summary).hasSize(40).endsWith("...");
        assertThat(summary).startsWith(longText.substring(0, 37));
        assertThat(ThinkingSummaryBuilder.truncate("short")).isEqualTo("short");
    }

    @Test
    void escalationPrefixIsDroppedFromSummary() {
        WorkLog log = logOf(LogEntry.escalation("budget approval"));

        assertThat(builder.generateSummary(log, 1)).isEqualTo("budget approval");
    }

    @Test
    void maxActionsMustBePositive() {
        WorkLog log = logOf(LogEntry.decision("x"));

        assertThatThrownBy(() -> builder.generateSummary(log, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detailsCarryIconsConfidenceDurationAndBot() {
        WorkLog log = logOf(
                LogEntry.decision("Route to coder", 0.85),
                LogEntry.tool("read_file", "42 lines", 120L).byBot("coder"),
                LogEntry.tool("lint", null, null));

        assertThat(builder.generateDetails(log)).containsExactly(
                "Step 1 🎯 Decision: Route to coder (85%)",
                "Step 2 🔧 Tool: read_file() → 42 lines [120ms] @coder",
                "Step 3 🔧 Tool: lint() → unknown");
    }

    @Test
    void botFilterRenumbersFromOne() {
        WorkLog log = logOf(
                LogEntry.decision("Plan"),
                LogEntry.tool("search", "ok", 5L).byBot("researcher"),
                LogEntry.decision("Write draft").byBot("coder"),
                LogEntry.correction("Fix typo").byBot("coder"));

        assertThat(builder.generateDetails(log, "coder")).containsExactly(
                "Step 1 🎯 Decision: Write draft",
                "Step 2 🔄 Correction: Fix typo");
        assertThat(builder.generateDetails(log, "leader")).containsExactly("Step 1 🎯 Decision: Plan");
        assertThat(builder.generateDetails(log, "nobody")).isEmpty();
    }

    @Test
    void expandedViewEndsWithFooterOfFilteredEntries() {
        WorkLog log = logOf(
                LogEntry.decision("Plan"),
                LogEntry.tool("search", "ok", 5L).byBot("researcher"));

        List<String> all = builder.renderExpanded(log, null);
        List<String> researcher = builder.renderExpanded(log, "researcher");

        assertThat(all).hasSize(3).last().isEqualTo("[2 steps • 1 decisions • 1 tools]");
        assertThat(researcher).last().isEqualTo("[1 steps • 0 decisions • 1 tools]");
    }

    @Test
    void everyLevelHasAnIcon() {
        for (LogLevel level : LogLevel.values()) {
            assertThat(ThinkingSummaryBuilder.iconFor(level)).isNotEqualTo("•");
        }
    }
}
