package events;

import exceptions.PayloadValidationException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import protocol.Frame;
import protocol.FrameType;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Routes decoded event frames to the handlers registered in a {@link HandlerTable}.
 * <p>
 * The payload is validated against the {@link EventType} of each handler. If a required field is missing,
 *  the event is dropped for that type with a warning. Neither a bad payload nor a failing handler
 *  affects the other handlers or the connection.
 */
public class EventDispatcher {

    private final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final HandlerTable handlerTable;

    public EventDispatcher(HandlerTable handlerTable) {
        this.handlerTable = handlerTable;
    }

    /**
     * Dispatch an event frame. Frames of other types are ignored.
     *
     * @return Number of handlers that were called.
     */
    public int dispatch(Frame frame) {
        if(frame.getType() != FrameType.EVENT)
            return 0;

        String eventName = frame.getEventName();
        if(!handlerTable.hasHandlers(eventName)) {
            logger.debug("No handlers for event '{}'", eventName);
            return 0;
        }

        JSONObject payload = frame.getPayload();
        // A payload rejected by one event type isn't decoded again for its other handlers.
        Set<EventType<?>> rejected = Collections.newSetFromMap(new IdentityHashMap<>());
        int called = 0;
        for(HandlerTable.Entry<?> entry : handlerTable.entriesFor(eventName)) {
            if(rejected.contains(entry.eventType))
                continue;

            Runnable call;
            try {
                call = entry.bind(payload);
            } catch (PayloadValidationException e) {
                rejected.add(entry.eventType);
                logger.warn("Dropping event '{}': {} Payload: {}", eventName, e.getMessage(), payload);
                continue;
            }

            try {
                call.run();
                called++;
            } catch (RuntimeException e) {
                logger.error("Handler of event '{}' failed.", eventName, e);
            }
        }
        return called;
    }
}
