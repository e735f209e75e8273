package events;

import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Maps application event names to the handlers registered for them.
 * A name can have any number of handlers, and they are called in no particular order.
 * <p>
 * Handlers are held strongly: the table keeps a handler, and everything it references, until the caller removes it.
 *  Whoever registers a handler owns its {@link Registration} and must call {@link Registration#remove()} once the
 *  handler is no longer wanted, or clear the table when its owner goes away.
 */
public class HandlerTable {

    final Map<String, Queue<Entry<?>>> handlerMap = new ConcurrentHashMap<>();

    /**
     * Register a handler for every occurrence of the given event.
     *
     * @return {@link Registration} that removes the handler again.
     */
    public <T> Registration register(EventType<T> eventType, EventHandler<T> handler) {
        Entry<T> entry = new Entry<>(eventType, handler);
        handlerMap.computeIfAbsent(eventType.getName(), k -> new ConcurrentLinkedQueue<>()).add(entry);
        return new Registration(entry);
    }

    void unregister(Entry<?> entry) {
        Queue<Entry<?>> entries = handlerMap.get(entry.eventType.getName());
        if(entries != null)
            entries.remove(entry);
    }

    /**
     * Remove all the handlers of the given event.
     */
    public void unregisterAll(String eventName) {
        handlerMap.remove(eventName);
    }

    public void clear() {
        handlerMap.clear();
    }

    public boolean hasHandlers(String eventName) {
        Queue<Entry<?>> entries = handlerMap.get(eventName);
        return entries != null && !entries.isEmpty();
    }

    public int handlerCount(String eventName) {
        Queue<Entry<?>> entries = handlerMap.get(eventName);
        return entries == null ? 0 : entries.size();
    }

    // Snapshot, so that handlers can (un)register while an event is being dispatched.
    List<Entry<?>> entriesFor(String eventName) {
        Queue<Entry<?>> entries = handlerMap.get(eventName);
        return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
    }

    static final class Entry<T> {

        final EventType<T> eventType;
        final EventHandler<T> handler;

        private Entry(EventType<T> eventType, EventHandler<T> handler) {
            this.eventType = eventType;
            this.handler = handler;
        }

        /**
         * Decode the payload for this handler.
         *
         * @return The handler call, bound to the decoded value.
         * @throws exceptions.PayloadValidationException if the payload doesn't fit the event type.
         */
        Runnable bind(JSONObject payload) {
            T value = eventType.decode(payload);
            return () -> handler.handle(value);
        }
    }

    /**
     * Handle of one registered handler.
     */
    public final class Registration {

        private final Entry<?> entry;

        private Registration(Entry<?> entry) {
            this.entry = entry;
        }

        public String getEventName() {
            return entry.eventType.getName();
        }

        /**
         * Remove the handler that this instance wraps. Calling it again has no effect.
         */
        public void remove() {
            HandlerTable.this.unregister(entry);
        }
    }
}
