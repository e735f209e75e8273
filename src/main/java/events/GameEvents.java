package events;

import exceptions.PayloadValidationException;
import org.json.JSONObject;

/**
 * Catalog of the application events exchanged with the game server.
 * <p>
 * Inbound events have an {@link EventType} constant and a payload class carrying the required fields.
 *  Creation and update events keep the complete payload as well, since their shape beyond the id belongs to
 *  the collaborator that handles them.
 * <p>
 * Outbound events ({@link #REGISTER_DEVICE}, {@link #CLIENT_DIAGNOSTIC_PONG}) have a name and a payload builder.
 */
public final class GameEvents {

    public static final EventType<ObjectCollected> OBJECT_COLLECTED =
            new EventType<>("object_collected", ObjectCollected::fromJson);
    public static final EventType<ObjectUncollected> OBJECT_UNCOLLECTED =
            new EventType<>("object_uncollected", ObjectUncollected::fromJson);
    public static final EventType<AllFindsReset> ALL_FINDS_RESET =
            new EventType<>("all_finds_reset", AllFindsReset::fromJson);
    public static final EventType<EntityChanged> OBJECT_CREATED =
            new EventType<>("object_created", payload -> EntityChanged.fromJson(payload, "id"));
    public static final EventType<ObjectDeleted> OBJECT_DELETED =
            new EventType<>("object_deleted", ObjectDeleted::fromJson);
    public static final EventType<EntityChanged> NPC_CREATED =
            new EventType<>("npc_created", payload -> EntityChanged.fromJson(payload, "id"));
    public static final EventType<EntityChanged> NPC_UPDATED =
            new EventType<>("npc_updated", payload -> EntityChanged.fromJson(payload, "id"));
    public static final EventType<NpcDeleted> NPC_DELETED =
            new EventType<>("npc_deleted", NpcDeleted::fromJson);
    public static final EventType<LocationUpdateIntervalChanged> LOCATION_UPDATE_INTERVAL_CHANGED =
            new EventType<>("location_update_interval_changed", LocationUpdateIntervalChanged::fromJson);
    public static final EventType<GameModeChanged> GAME_MODE_CHANGED =
            new EventType<>("game_mode_changed", GameModeChanged::fromJson);
    public static final EventType<AdminDiagnosticPing> ADMIN_DIAGNOSTIC_PING =
            new EventType<>("admin_diagnostic_ping", AdminDiagnosticPing::fromJson);

    public static final String REGISTER_DEVICE = "register_device";
    public static final String CLIENT_DIAGNOSTIC_PONG = "client_diagnostic_pong";

    private GameEvents() {
    }

    /**
     * Payload of {@link #REGISTER_DEVICE}, sent once after every completed handshake.
     */
    public static JSONObject registerDevice(String deviceUuid) {
        return new JSONObject().put("device_uuid", deviceUuid);
    }

    /**
     * Payload of {@link #CLIENT_DIAGNOSTIC_PONG}, the answer to {@link #ADMIN_DIAGNOSTIC_PING}.
     *
     * @param ping The ping being answered.
     * @param clientTimestampMillis Client clock at the time of answering.
     */
    public static JSONObject clientDiagnosticPong(AdminDiagnosticPing ping, long clientTimestampMillis) {
        return new JSONObject()
                .put("ping_id", ping.getPingId())
                .put("client_timestamp", clientTimestampMillis / 1000.0)
                .put("admin_session_id", ping.getAdminSessionId());
    }

    /*
        Ids are strings on the wire, but numeric ids are accepted as well.
     */
    static String requireId(JSONObject payload, String field) {
        Object value = payload.opt(field);
        if(value instanceof String && !((String) value).isEmpty())
            return (String) value;
        if(value instanceof Number)
            return value.toString();
        throw new PayloadValidationException(describe(field, value, "an id"));
    }

    static String requireString(JSONObject payload, String field) {
        Object value = payload.opt(field);
        if(value instanceof String)
            return (String) value;
        throw new PayloadValidationException(describe(field, value, "a string"));
    }

    static double requireNumber(JSONObject payload, String field) {
        Object value = payload.opt(field);
        if(value instanceof Number)
            return ((Number) value).doubleValue();
        throw new PayloadValidationException(describe(field, value, "a number"));
    }

    private static String describe(String field, Object value, String expected) {
        if(value == null || JSONObject.NULL.equals(value))
            return "Required field '" + field + "' is missing.";
        return "Field '" + field + "' should be " + expected + " but was: " + value;
    }

    public static final class ObjectCollected {

        private final String objectId;
        private final String foundBy;
        private final String foundAt;

        public ObjectCollected(String objectId, String foundBy, String foundAt) {
            this.objectId = objectId;
            this.foundBy = foundBy;
            this.foundAt = foundAt;
        }

        static ObjectCollected fromJson(JSONObject payload) {
            return new ObjectCollected(requireId(payload, "object_id"),
                                        requireString(payload, "found_by"),
                                        requireString(payload, "found_at"));
        }

        public String getObjectId() {
            return objectId;
        }

        public String getFoundBy() {
            return foundBy;
        }

        // ISO-8601 timestamp, as sent by the server.
        public String getFoundAt() {
            return foundAt;
        }

        @Override
        public String toString() {
            return "ObjectCollected{objectId=" + objectId + ", foundBy=" + foundBy + ", foundAt=" + foundAt + '}';
        }
    }

    public static final class ObjectUncollected {

        private final String objectId;

        public ObjectUncollected(String objectId) {
            this.objectId = objectId;
        }

        static ObjectUncollected fromJson(JSONObject payload) {
            return new ObjectUncollected(requireId(payload, "object_id"));
        }

        public String getObjectId() {
            return objectId;
        }
    }

    public static final class AllFindsReset {

        static AllFindsReset fromJson(JSONObject payload) {
            return new AllFindsReset();
        }
    }

    /**
     * Payload of creation and update events: the entity id plus everything else the server sent.
     */
    public static final class EntityChanged {

        private final String id;
        private final String attributes;

        public EntityChanged(String id, JSONObject attributes) {
            this.id = id;
            this.attributes = attributes.toString();
        }

        static EntityChanged fromJson(JSONObject payload, String idField) {
            return new EntityChanged(requireId(payload, idField), payload);
        }

        public String getId() {
            return id;
        }

        /**
         * @return A copy of the complete payload, including the id.
         */
        public JSONObject getAttributes() {
            return new JSONObject(attributes);
        }
    }

    public static final class ObjectDeleted {

        private final String objectId;

        public ObjectDeleted(String objectId) {
            this.objectId = objectId;
        }

        static ObjectDeleted fromJson(JSONObject payload) {
            return new ObjectDeleted(requireId(payload, "object_id"));
        }

        public String getObjectId() {
            return objectId;
        }
    }

    public static final class NpcDeleted {

        private final String npcId;

        public NpcDeleted(String npcId) {
            this.npcId = npcId;
        }

        static NpcDeleted fromJson(JSONObject payload) {
            return new NpcDeleted(requireId(payload, "npc_id"));
        }

        public String getNpcId() {
            return npcId;
        }
    }

    public static final class LocationUpdateIntervalChanged {

        private final double intervalSeconds;

        public LocationUpdateIntervalChanged(double intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        static LocationUpdateIntervalChanged fromJson(JSONObject payload) {
            double interval = requireNumber(payload, "interval_seconds");
            if(interval <= 0)
                throw new PayloadValidationException("Field 'interval_seconds' should be positive but was: " + interval);
            return new LocationUpdateIntervalChanged(interval);
        }

        public double getIntervalSeconds() {
            return intervalSeconds;
        }
    }

    public static final class GameModeChanged {

        private final String gameMode;

        public GameModeChanged(String gameMode) {
            this.gameMode = gameMode;
        }

        static GameModeChanged fromJson(JSONObject payload) {
            return new GameModeChanged(requireString(payload, "game_mode"));
        }

        public String getGameMode() {
            return gameMode;
        }
    }

    public static final class AdminDiagnosticPing {

        private final String pingId;
        private final String adminSessionId;

        public AdminDiagnosticPing(String pingId, String adminSessionId) {
            this.pingId = pingId;
            this.adminSessionId = adminSessionId;
        }

        static AdminDiagnosticPing fromJson(JSONObject payload) {
            return new AdminDiagnosticPing(requireId(payload, "ping_id"),
                                            requireId(payload, "admin_session_id"));
        }

        public String getPingId() {
            return pingId;
        }

        public String getAdminSessionId() {
            return adminSessionId;
        }
    }
}
