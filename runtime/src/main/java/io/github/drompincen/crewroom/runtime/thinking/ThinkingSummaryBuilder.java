package io.github.drompincen.crewroom.runtime.thinking;

import io.github.drompincen.crewroom.protocol.thinking.ThinkingStats;
import io.github.drompincen.crewroom.protocol.worklog.LogEntry;
import io.github.drompincen.crewroom.protocol.worklog.LogLevel;
import io.github.drompincen.crewroom.runtime.room.RoomManager;
import io.github.drompincen.crewroom.runtime.worklog.WorkLog;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the one-line summary, the step listing and the counts shown for a work log.
 * Holds no state: the same entries always render to the same text.
 */
@Component
public class ThinkingSummaryBuilder {

    public static final String NO_ACTIONS = "no recorded actions";
    public static final int DEFAULT_MAX_ACTIONS = 2;
    static final int MAX_CLAUSE_LENGTH = 40;
    private static final String ELLIPSIS = "...";

    private static final Set<LogLevel> PRIMARY_LEVELS =
            EnumSet.of(LogLevel.DECISION, LogLevel.TOOL, LogLevel.COORDINATION);
    private static final Set<LogLevel> FALLBACK_LEVELS =
            EnumSet.of(LogLevel.ERROR, LogLevel.CORRECTION);

    private static final Map<LogLevel, String> ICONS = new EnumMap<>(LogLevel.class);
    private static final Map<LogLevel, String> LABELS = new EnumMap<>(LogLevel.class);

    static {
        ICONS.put(LogLevel.DECISION, "🎯");
        ICONS.put(LogLevel.TOOL, "🔧");
        ICONS.put(LogLevel.CORRECTION, "🔄");
        ICONS.put(LogLevel.ERROR, "❌");
        ICONS.put(LogLevel.COORDINATION, "📋");

        LABELS.put(LogLevel.DECISION, "Decision");
        LABELS.put(LogLevel.TOOL, "Tool");
        LABELS.put(LogLevel.CORRECTION, "Correction");
        LABELS.put(LogLevel.ERROR, "Error");
        LABELS.put(LogLevel.COORDINATION, "Coordination");
    }

    private static final Comparator<LogEntry> BY_SEQUENCE = Comparator.comparingLong(LogEntry::sequence);

    private final String coordinatorId;

    @Autowired
    public ThinkingSummaryBuilder(@Value("${crewroom.coordinator-id:leader}") String coordinatorId) {
        this.coordinatorId = coordinatorId;
    }

    public ThinkingSummaryBuilder() {
        this(RoomManager.DEFAULT_COORDINATOR);
    }

    public String generateSummary(WorkLog log) {
        return generateSummary(log.entries(), DEFAULT_MAX_ACTIONS);
    }

    public String generateSummary(WorkLog log, int maxActions) {
        return generateSummary(log.entries(), maxActions);
    }

    /**
     * Joins the first {@code maxActions} decision, tool and coordination clauses. Errors and
     * corrections are only used when none of those exist.
     */
    public String generateSummary(List<LogEntry> entries, int maxActions) {
        if (maxActions < 1) {
            throw new IllegalArgumentException("maxActions must be at least 1, was " + maxActions);
        }
        if (entries.isEmpty()) {
            return NO_ACTIONS;
        }
        List<LogEntry> picked = select(entries, PRIMARY_LEVELS);
        if (picked.isEmpty()) {
            picked = select(entries, FALLBACK_LEVELS);
        }
        if (picked.isEmpty()) {
            return NO_ACTIONS;
        }
        return picked.stream()
                .limit(maxActions)
                .map(ThinkingSummaryBuilder::clause)
                .collect(Collectors.joining(", "));
    }

    public List<String> generateDetails(WorkLog log) {
        return generateDetails(log.entries(), null);
    }

    public List<String> generateDetails(WorkLog log, String botFilter) {
        return generateDetails(log.entries(), botFilter);
    }

    /**
     * One line per entry, numbered from 1 among the entries that pass {@code botFilter}.
     * Entries without a bot belong to the coordinator.
     */
    public List<String> generateDetails(List<LogEntry> entries, String botFilter) {
        List<LogEntry> shown = filterByBot(entries, botFilter);
        List<String> lines = new ArrayList<>(shown.size());
        int step = 1;
        for (LogEntry entry : shown) {
            lines.add(detailLine(step++, entry, botFilter == null));
        }
        return Collections.unmodifiableList(lines);
    }

    public ThinkingStats getStats(WorkLog log) {
        return getStats(log.entries());
    }

    public ThinkingStats getStats(List<LogEntry> entries) {
        Map<LogLevel, Integer> counts = new EnumMap<>(LogLevel.class);
        long totalDuration = 0;
        for (LogEntry e : entries) {
            counts.merge(e.level(), 1, Integer::sum);
            if (e.durationMs() != null) totalDuration += e.durationMs();
        }
        return new ThinkingStats(
                entries.size(),
                counts.getOrDefault(LogLevel.DECISION, 0),
                counts.getOrDefault(LogLevel.TOOL, 0),
                counts.getOrDefault(LogLevel.CORRECTION, 0),
                counts.getOrDefault(LogLevel.ERROR, 0),
                counts.getOrDefault(LogLevel.COORDINATION, 0),
                totalDuration);
    }

    /**
     * Detail lines followed by the stats footer, both over the filtered entries.
     */
    public List<String> renderExpanded(WorkLog log, String botFilter) {
        List<LogEntry> entries = log.entries();
        List<String> lines = new ArrayList<>(generateDetails(entries, botFilter));
        lines.add(getStats(filterByBot(entries, botFilter)).footer());
        return Collections.unmodifiableList(lines);
    }

    public static String iconFor(LogLevel level) {
        return ICONS.getOrDefault(level, "•");
    }

    private List<LogEntry> filterByBot(List<LogEntry> entries, String botFilter) {
        return entries.stream()
                .filter(e -> botFilter == null || botFilter.equals(effectiveBot(e)))
                .sorted(BY_SEQUENCE)
                .toList();
    }

    private String effectiveBot(LogEntry entry) {
        return entry.botName() != null ? entry.botName() : coordinatorId;
    }

    private static List<LogEntry> select(List<LogEntry> entries, Set<LogLevel> levels) {
        return entries.stream()
                .filter(e -> levels.contains(e.level()))
                .sorted(BY_SEQUENCE)
                .toList();
    }

    private static String clause(LogEntry entry) {
        return switch (entry.level()) {
            case TOOL -> entry.toolName() != null ? entry.toolName() : "tool";
            case CORRECTION -> "corrected " + truncate(entry.message());
            case ERROR -> "failed: " + truncate(entry.message());
            case DECISION, COORDINATION -> truncate(stripEscalation(entry));
        };
    }

    private static String detailLine(int step, LogEntry entry, boolean showBot) {
        StringBuilder line = new StringBuilder()
                .append("Step ").append(step).append(' ')
                .append(iconFor(entry.level())).append(' ')
                .append(LABELS.get(entry.level())).append(": ");
        if (entry.level() == LogLevel.TOOL) {
            line.append(entry.toolName() != null ? entry.toolName() : "tool").append("() → ")
                    .append(entry.result() != null ? entry.result() : "unknown");
        } else {
            line.append(entry.message());
        }
        if (entry.confidence() != null) {
            line.append(" (").append(Math.round(entry.confidence() * 100)).append("%)");
        }
        if (entry.durationMs() != null) {
            line.append(" [").append(entry.durationMs()).append("ms]");
        }
        if (showBot && entry.botName() != null) {
            line.append(" @").append(entry.botName());
        }
        return line.toString();
    }

    private static String stripEscalation(LogEntry entry) {
        String msg = entry.message();
        if (entry.escalation() && msg.startsWith(LogEntry.ESCALATION_PREFIX)) {
            return msg.substring(LogEntry.ESCALATION_PREFIX.length());
        }
        return msg;
    }

    static String truncate(String text) {
        if (text.length() <= MAX_CLAUSE_LENGTH) return text;
        return text.substring(0, MAX_CLAUSE_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
    }
}
