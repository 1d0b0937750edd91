package io.github.drompincen.crewroom.runtime.room;

import io.github.drompincen.crewroom.persistence.PersistenceException;
import io.github.drompincen.crewroom.persistence.document.RoomDocument;
import io.github.drompincen.crewroom.persistence.repository.RoomRepository;
import io.github.drompincen.crewroom.protocol.api.RoomDto;
import io.github.drompincen.crewroom.protocol.api.RoomSummary;
import io.github.drompincen.crewroom.protocol.api.RoomType;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Single source of truth for which rooms exist and who is in them. All writes go to the
 * {@link RoomRepository} before the in-memory view is updated, and every mutation of a given
 * room id runs under that id's lock. Locks are striped over a fixed pool, so ids that were
 * never created cost nothing.
 */
@Service
public class RoomManager {

    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    public static final String DEFAULT_ROOM_ID = "general";
    public static final String DEFAULT_ROOM_NAME = "General";
    public static final String DEFAULT_COORDINATOR = "leader";

    static final int LOCK_STRIPES = 64;

    private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9-]");
    private static final Pattern DASH_RUNS = Pattern.compile("-{2,}");

    private static final Comparator<RoomDocument> LISTING_ORDER =
            Comparator.comparing((RoomDocument r) -> !r.isDefaultRoom())
                    .thenComparingLong(RoomDocument::getOrdinal)
                    .thenComparing(RoomDocument::getId);

    private final RoomRepository roomRepository;
    private final String coordinatorId;
    private final Clock clock;
    private final Map<String, RoomDocument> rooms = new ConcurrentHashMap<>();
    private final ReentrantLock[] lockStripes = new ReentrantLock[LOCK_STRIPES];
    private final Map<String, String> sessionFocus = new ConcurrentHashMap<>();
    private final AtomicLong ordinals = new AtomicLong();
    private final Object initLock = new Object();

    private volatile String defaultRoomId;
    private volatile boolean initialized;

    @Autowired
    public RoomManager(RoomRepository roomRepository,
                       @Value("${crewroom.coordinator-id:leader}") String coordinatorId,
                       @Value("${crewroom.default-room-id:general}") String defaultRoomId) {
        this(roomRepository, coordinatorId, defaultRoomId, Clock.systemUTC());
    }

    public RoomManager(RoomRepository roomRepository) {
        this(roomRepository, DEFAULT_COORDINATOR, DEFAULT_ROOM_ID, Clock.systemUTC());
    }

    RoomManager(RoomRepository roomRepository, String coordinatorId, String defaultRoomId, Clock clock) {
        this.roomRepository = roomRepository;
        this.coordinatorId = normalizeParticipant(coordinatorId);
        this.defaultRoomId = normalizeId(defaultRoomId);
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            lockStripes[i] = new ReentrantLock();
        }
    }

    /**
     * Loads every persisted room and creates the default OPEN room if none is marked default.
     * Safe to call on every start.
     */
    @PostConstruct
    public void initialize() {
        synchronized (initLock) {
            List<RoomDocument> stored = roomRepository.loadAll();
            List<RoomDocument> defaults = stored.stream().filter(RoomDocument::isDefaultRoom).toList();
            if (defaults.size() > 1) {
                throw new PersistenceException("Multiple default rooms found: "
                        + defaults.stream().map(RoomDocument::getId).collect(Collectors.joining(", ")));
            }

            Set<String> storedIds = new LinkedHashSet<>();
            for (RoomDocument doc : stored) {
                rooms.put(doc.getId(), doc);
                storedIds.add(doc.getId());
                ordinals.accumulateAndGet(doc.getOrdinal(), Math::max);
            }
            rooms.keySet().retainAll(storedIds);

            if (defaults.isEmpty()) {
                createDefaultRoom();
            } else {
                defaultRoomId = defaults.get(0).getId();
            }
            initialized = true;
            log.info("Room manager ready: {} room(s), default room '{}'", rooms.size(), defaultRoomId);
        }
    }

    private void createDefaultRoom() {
        withRoomLock(defaultRoomId, () -> {
            if (rooms.containsKey(defaultRoomId)) {
                throw new PersistenceException("Room '" + defaultRoomId
                        + "' exists but is not marked as the default room");
            }
            RoomDocument general = new RoomDocument();
            general.setId(defaultRoomId);
            general.setName(DEFAULT_ROOM_NAME);
            general.setType(RoomType.OPEN);
            general.setParticipants(List.of(coordinatorId));
            general.setOwner("system");
            general.setCreatedAt(clock.instant());
            general.setDefaultRoom(true);
            general.setOrdinal(ordinals.incrementAndGet());
            roomRepository.save(general);
            rooms.put(defaultRoomId, general);
            log.info("Created default room '{}' with {}", defaultRoomId, coordinatorId);
            return general;
        });
    }

    public RoomDto createRoom(String id, String type, List<String> initialParticipants) {
        return createRoom(id, null, parseType(id, type), initialParticipants);
    }

    public RoomDto createRoom(String id, RoomType type, List<String> initialParticipants) {
        return createRoom(id, null, type, initialParticipants);
    }

    /**
     * Creates a room. The id is normalized to slug form before the uniqueness check. The
     * coordinating agent is prepended for OPEN, PROJECT and COORDINATION rooms; a DIRECT room
     * takes its first listed participant as the creator and falls back to the coordinator only
     * when no participant is given.
     */
    public RoomDto createRoom(String id, String name, RoomType type, List<String> initialParticipants) {
        requireInitialized();
        String roomId = normalizeId(id);
        if (type == null) {
            throw new InvalidRoomTypeException(roomId, "null");
        }
        List<String> participants = initialMembers(type, initialParticipants);
        if (participants.size() > type.capacity()) {
            throw new RoomCapacityException(roomId, type, type.capacity());
        }

        return withRoomLock(roomId, () -> {
            if (rooms.containsKey(roomId) || roomRepository.exists(roomId)) {
                throw new DuplicateRoomException(roomId);
            }
            RoomDocument doc = new RoomDocument();
            doc.setId(roomId);
            doc.setName(name != null && !name.isBlank() ? name.trim() : roomId);
            doc.setType(type);
            doc.setParticipants(participants);
            doc.setOwner("user");
            doc.setCreatedAt(clock.instant());
            doc.setDefaultRoom(false);
            doc.setOrdinal(ordinals.incrementAndGet());
            roomRepository.save(doc);
            rooms.put(roomId, doc);
            log.info("Created {} room '{}' with participants {}", type, roomId, participants);
            return doc.toDto();
        });
    }

    /**
     * Looks up a room. Absence is reported as an empty result, never as an exception.
     */
    public Optional<RoomDto> getRoom(String id) {
        requireInitialized();
        String roomId = normalizeOrNull(id);
        if (roomId == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(roomId)).map(RoomDocument::toDto);
    }

    public RoomDto getDefaultRoom() {
        requireInitialized();
        return rooms.get(defaultRoomId).toDto();
    }

    /**
     * Default room first, then creation order.
     */
    public List<RoomSummary> listRooms() {
        requireInitialized();
        return rooms.values().stream()
                .sorted(LISTING_ORDER)
                .map(doc -> doc.toDto().toSummary())
                .toList();
    }

    public List<String> getParticipants(String roomId) {
        return getRoom(roomId).map(RoomDto::participants)
                .orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    /**
     * Adds a participant. Inviting someone already present succeeds without change.
     */
    public RoomDto inviteParticipant(String roomId, String participantId) {
        requireInitialized();
        String id = normalizeOrNull(roomId);
        if (id == null) throw new RoomNotFoundException(String.valueOf(roomId));
        String participant = normalizeParticipant(participantId);
        if (!rooms.containsKey(id)) {
            throw new RoomNotFoundException(id);
        }

        return withRoomLock(id, () -> {
            RoomDocument current = rooms.get(id);
            if (current == null) {
                throw new RoomNotFoundException(id);
            }
            if (current.getParticipants().contains(participant)) {
                log.debug("'{}' already in room '{}'", participant, id);
                return current.toDto();
            }
            RoomType type = current.getType();
            if (current.getParticipants().size() >= type.capacity()) {
                throw new RoomCapacityException(id, type, type.capacity());
            }
            RoomDocument updated = current.copy();
            updated.getParticipants().add(participant);
            roomRepository.save(updated);
            rooms.put(id, updated);
            log.info("Invited '{}' to room '{}'", participant, id);
            return updated.toDto();
        });
    }

    /**
     * Sets the room a session is currently looking at. This is session state only; the room
     * record is not touched.
     */
    public RoomDto switchFocus(String sessionKey, String roomId) {
        requireSessionKey(sessionKey);
        RoomDto room = getRoom(roomId).orElseThrow(() -> new RoomNotFoundException(String.valueOf(roomId)));
        sessionFocus.put(sessionKey, room.id());
        log.debug("Session {} switched focus to room '{}'", sessionKey, room.id());
        return room;
    }

    public Optional<RoomDto> currentRoom(String sessionKey) {
        requireSessionKey(sessionKey);
        String focused = sessionFocus.get(sessionKey);
        return focused == null ? Optional.empty() : getRoom(focused);
    }

    public void clearFocus(String sessionKey) {
        requireSessionKey(sessionKey);
        sessionFocus.remove(sessionKey);
    }

    public boolean isInitialized() {
        return initialized;
    }

    private List<String> initialMembers(RoomType type, List<String> requested) {
        Set<String> members = new LinkedHashSet<>();
        if (type != RoomType.DIRECT) {
            members.add(coordinatorId);
        }
        if (requested != null) {
            for (String p : requested) {
                members.add(normalizeParticipant(p));
            }
        }
        if (members.isEmpty()) {
            members.add(coordinatorId);
        }
        return new ArrayList<>(members);
    }

    private <T> T withRoomLock(String roomId, Supplier<T> action) {
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String roomId) {
        return lockStripes[Math.floorMod(roomId.hashCode(), LOCK_STRIPES)];
    }

    int lockCount() {
        return lockStripes.length;
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("RoomManager has not been initialized");
        }
    }

    private static void requireSessionKey(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException("sessionKey is required");
        }
    }

    private static RoomType parseType(String roomId, String type) {
        if (type == null || type.isBlank()) {
            throw new InvalidRoomTypeException(roomId, String.valueOf(type));
        }
        try {
            return RoomType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRoomTypeException(roomId, type);
        }
    }

    /**
     * Lowercases and reduces a room id to {@code [a-z0-9-]}, e.g. "Launch Plan_2" becomes
     * "launch-plan-2".
     */
    public static String normalizeId(String raw) {
        String slug = normalizeOrNull(raw);
        if (slug == null) {
            throw new IllegalArgumentException("Room id '" + raw + "' has no usable characters");
        }
        return slug;
    }

    private static String normalizeOrNull(String raw) {
        if (raw == null) return null;
        String slug = SEPARATORS.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = NON_SLUG.matcher(slug).replaceAll("");
        slug = DASH_RUNS.matcher(slug).replaceAll("-");
        while (slug.startsWith("-")) slug = slug.substring(1);
        while (slug.endsWith("-")) slug = slug.substring(0, slug.length() - 1);
        return slug.isEmpty() ? null : slug;
    }

    static String normalizeParticipant(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Participant id must not be blank");
        }
        String p = raw.trim();
        if (p.startsWith("@")) p = p.substring(1).trim();
        if (p.isEmpty()) {
            throw new IllegalArgumentException("Participant id must not be blank");
        }
        return p.toLowerCase(Locale.ROOT);
    }
}
