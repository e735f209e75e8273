package events;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class HandlerTableTest {

    private HandlerTable handlerTable;

    @Before
    public void beforeEach() {
        handlerTable = new HandlerTable();
    }

    @Test
    public void testRegister() {
        handlerTable.register(GameEvents.NPC_CREATED, payload -> {});
        handlerTable.register(GameEvents.NPC_CREATED, payload -> {});

        assertTrue(handlerTable.hasHandlers("npc_created"));
        assertEquals(2, handlerTable.handlerCount("npc_created"));
        assertEquals(0, handlerTable.handlerCount("npc_updated"));
    }

    @Test
    public void testRegistrationRemove() {
        HandlerTable.Registration first = handlerTable.register(GameEvents.NPC_CREATED, payload -> {});
        handlerTable.register(GameEvents.NPC_CREATED, payload -> {});

        assertEquals("npc_created", first.getEventName());
        first.remove();
        assertEquals(1, handlerTable.handlerCount("npc_created"));

        // Removing twice is harmless.
        first.remove();
        assertEquals(1, handlerTable.handlerCount("npc_created"));
    }

    @Test
    public void testUnregisterAllAndClear() {
        handlerTable.register(GameEvents.NPC_CREATED, payload -> {});
        handlerTable.register(GameEvents.NPC_DELETED, payload -> {});

        handlerTable.unregisterAll("npc_created");
        assertFalse(handlerTable.hasHandlers("npc_created"));
        assertTrue(handlerTable.hasHandlers("npc_deleted"));

        handlerTable.clear();
        assertFalse(handlerTable.hasHandlers("npc_deleted"));
    }

    @Test
    public void testEntriesAreSnapshot() {
        handlerTable.register(GameEvents.NPC_CREATED, payload -> {});

        int before = handlerTable.entriesFor("npc_created").size();
        handlerTable.register(GameEvents.NPC_CREATED, payload -> {});

        assertEquals(1, before);
        assertEquals(2, handlerTable.entriesFor("npc_created").size());
        assertTrue(handlerTable.entriesFor("unknown").isEmpty());
    }
}
