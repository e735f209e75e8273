package common;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * <h1>common.Observable</h1>
 * Instances of this class provide a way for clients to be notified when a lifecycle event that intrigues them occurs,
 *  like a connection state change or a received pong.
 * To subscribe for an <b>event</b>, use {@link #on(String, Callback)} and {@link #once(String, Callback)}.
 * <p>
 * Events are emitted from the owner's worker thread, while callbacks may be registered from any thread.
 */
public class Observable {

    /**
     * Maps event names to a Queue of {@link Callback}.
     */
    final Map<String, Queue<Callback>> callbackMap;

    protected Observable() {
        callbackMap = new ConcurrentHashMap<>();
    }

    /**
     * Notify the observers (if any) of the occurrence of a given event.
     *
     * @param event The name of the occurred event.
     * @param args The arguments to pass to observers' callback.
     */
    public void emitEvent(String event, Object... args) {
        Queue<Callback> callbacks = callbackMap.get(event);
        if(callbacks != null)
            callbacks.forEach(callback -> callback.call(args));
    }

    /**
     * Register a {@link Callback} that will be called by the {@code Observable} instance, <b>every time</b> the event occurs.
     * @see #once(String, Callback) To register a Callback that will only be called once.
     *
     * @param event Name of the event the client wants to listen to.
     * @param callback {@link Callback} instance that will be called every time when the event occurs.
     * @return {@link CallbackHandle} that can be used to remove the Callback
     *          or chain further calls to {@link #on(String, Callback)} and {@link #once(String, Callback)}.
     */
    public CallbackHandle on(String event, Callback callback) {
        callbackMap.computeIfAbsent(event, k -> new ConcurrentLinkedQueue<>()).add(callback);
        return new CallbackHandle(event, callback);
    }

    /**
     * Register a {@link Callback} that will only be called <b>once</b> by the {@code Observable} instance when the event occurs.
     * @see #on(String, Callback) to register a recurring Callback.
     */
    public CallbackHandle once(String event, Callback callback) {
        Callback onceListener = new Callback() {
            @Override
            public void call(Object... args) {
                // The callback could cause the same event to occur again, so remove it first.
                // Only the emitter that manages to remove it gets to call it.
                if(Observable.this.remove(event, this))
                    callback.call(args);
            }
        };

        return on(event, onceListener);
    }

    /**
     * Remove a specific Callback when the client is no longer interested in the event.
     *
     * @param event Name of the event the client wants to remove a Callback from.
     * @param callback The callback to remove.
     */
    public void removeListener(String event, Callback callback) {
        remove(event, callback);
    }

    private boolean remove(String event, Callback callback) {
        Queue<Callback> callbacks = callbackMap.get(event);
        return callbacks != null && callbacks.remove(callback);
    }

    /**
     * Remove all the Callbacks for the given event.
     */
    public void removeAllListenersForEvent(String event) {
        callbackMap.remove(event);
    }

    /**
     * Clears all the callbacks for all the events.
     */
    public void removeAllListeners() {
        callbackMap.clear();
    }

    /**
     * Wraps the registered callback and event name, so that a client has a way to remove it when no longer interested.
     * Exposes {@link CallbackHandle#on(String, Callback)} and {@link CallbackHandle#once(String, Callback)} to allow chaining.
     *
     * <p>
     * Example:
     * {@code client.on("connected", args -> {}).on("error", args -> {});}
     */
    public class CallbackHandle {

        private final String event;
        private final Callback callback;

        private CallbackHandle(String event, Callback callback) {
            this.event = event;
            this.callback = callback;
        }

        /**
         * @see Observable#on(String, Callback)
         */
        public CallbackHandle on(String event, Callback callback) {
            return Observable.this.on(event, callback);
        }

        /**
         * @see Observable#once(String, Callback)
         */
        public CallbackHandle once(String event, Callback callback) {
            return Observable.this.once(event, callback);
        }

        /**
         * Remove the callback that this instance wraps.
         */
        public void remove() {
            Observable.this.removeListener(event, callback);
        }
    }

    /**
     * Implement this interface in order to register a callback to an Observable for any interested events.
     */
    @FunctionalInterface
    public interface Callback {

        /**
         * @param args Any argument that Observable wants to pass to its observers.
         */
        void call(Object... args);
    }
}
