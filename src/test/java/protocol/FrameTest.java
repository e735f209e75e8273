package protocol;

import org.json.JSONObject;
import org.junit.Test;

import static org.junit.Assert.*;

public class FrameTest {

    @Test
    public void testPayloadIsImmutable() {
        JSONObject payload = new JSONObject().put("object_id", "abc");
        Frame frame = Frame.event("object_deleted", payload);

        payload.put("object_id", "changed");
        frame.getPayload().put("object_id", "changed too");

        assertEquals("abc", frame.getPayload().getString("object_id"));
    }

    @Test
    public void testEquals() {
        assertEquals(Frame.event("a", new JSONObject().put("x", 1)), Frame.event("a", new JSONObject().put("x", 1)));
        assertNotEquals(Frame.event("a", new JSONObject().put("x", 1)), Frame.event("b", new JSONObject().put("x", 1)));
        assertNotEquals(Frame.event("a", new JSONObject().put("x", 1)), Frame.event("a", new JSONObject().put("x", 2)));
        assertEquals(Frame.unknown("zz"), Frame.unknown("zz"));
        assertNotEquals(Frame.PING, Frame.PONG);
    }

    @Test
    public void testIsEvent() {
        assertTrue(Frame.event("connected", new JSONObject()).isEvent("connected"));
        assertFalse(Frame.event("connected", new JSONObject()).isEvent("other"));
        assertFalse(Frame.PING.isEvent("connected"));
    }
}
