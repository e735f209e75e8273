package events;

/**
 * Implement this interface to receive the validated payload of an application event.
 *
 * @param <T> Typed payload of the event.
 */
@FunctionalInterface
public interface EventHandler<T> {

    void handle(T payload);
}
