package events;

import exceptions.PayloadValidationException;
import org.json.JSONObject;
import org.junit.Test;

import static org.junit.Assert.*;

public class GameEventsTest {

    @Test
    public void testEntityChangedKeepsWholePayload() {
        JSONObject payload = new JSONObject().put("id", "npc-7").put("name", "Captain").put("latitude", 51.5);
        GameEvents.EntityChanged changed = GameEvents.NPC_UPDATED.decode(payload);

        assertEquals("npc-7", changed.getId());
        assertEquals("Captain", changed.getAttributes().getString("name"));

        // Callers get a copy.
        changed.getAttributes().put("name", "Changed");
        assertEquals("Captain", changed.getAttributes().getString("name"));
    }

    @Test
    public void testNumericIdsAreAccepted() {
        assertEquals("42", GameEvents.OBJECT_CREATED.decode(new JSONObject().put("id", 42)).getId());
        assertEquals("7", GameEvents.OBJECT_DELETED.decode(new JSONObject().put("object_id", 7)).getObjectId());
    }

    @Test
    public void testMissingOrInvalidFields() {
        PayloadValidationException missing = assertThrows(PayloadValidationException.class,
                () -> GameEvents.NPC_DELETED.decode(new JSONObject()));
        assertEquals("Required field 'npc_id' is missing.", missing.getMessage());

        assertThrows(PayloadValidationException.class,
                () -> GameEvents.OBJECT_UNCOLLECTED.decode(new JSONObject().put("object_id", "")));
        assertThrows(PayloadValidationException.class,
                () -> GameEvents.GAME_MODE_CHANGED.decode(new JSONObject().put("game_mode", 3)));
        assertThrows(PayloadValidationException.class,
                () -> GameEvents.OBJECT_CREATED.decode(new JSONObject().put("id", JSONObject.NULL)));
    }

    @Test
    public void testLocationUpdateInterval() {
        assertEquals(2.5, GameEvents.LOCATION_UPDATE_INTERVAL_CHANGED
                .decode(new JSONObject().put("interval_seconds", 2.5)).getIntervalSeconds(), 0.0);

        assertThrows(PayloadValidationException.class, () -> GameEvents.LOCATION_UPDATE_INTERVAL_CHANGED
                .decode(new JSONObject().put("interval_seconds", 0)));
        assertThrows(PayloadValidationException.class, () -> GameEvents.LOCATION_UPDATE_INTERVAL_CHANGED
                .decode(new JSONObject().put("interval_seconds", "5")));
    }

    @Test
    public void testAllFindsResetHasNoRequiredFields() {
        assertNotNull(GameEvents.ALL_FINDS_RESET.decode(new JSONObject()));
    }

    @Test
    public void testOutboundPayloads() {
        assertEquals("d-1", GameEvents.registerDevice("d-1").getString("device_uuid"));

        GameEvents.AdminDiagnosticPing ping = GameEvents.ADMIN_DIAGNOSTIC_PING
                .decode(new JSONObject().put("ping_id", "p-1").put("admin_session_id", "admin-9"));
        JSONObject pong = GameEvents.clientDiagnosticPong(ping, 1_700_000_000_500L);

        assertEquals("p-1", pong.getString("ping_id"));
        assertEquals("admin-9", pong.getString("admin_session_id"));
        assertEquals(1_700_000_000.5, pong.getDouble("client_timestamp"), 0.0001);
    }
}
