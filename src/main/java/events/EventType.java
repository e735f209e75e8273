package events;

import exceptions.PayloadValidationException;
import org.json.JSONObject;

import java.util.Objects;

/**
 * Names an application event and knows how to turn its JSON payload into a typed value.
 * Validation happens once, when the event is decoded, so handlers only ever see complete payloads.
 *
 * @param <T> Typed payload of the event.
 */
public final class EventType<T> {

    private final String name;
    private final PayloadDecoder<T> decoder;

    public EventType(String name, PayloadDecoder<T> decoder) {
        this.name = Objects.requireNonNull(name, "name");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * An event that isn't part of the catalog. Handlers receive the payload object as is.
     */
    public static EventType<JSONObject> raw(String name) {
        return new EventType<>(name, payload -> payload);
    }

    public String getName() {
        return name;
    }

    /**
     * @throws PayloadValidationException if a required field is missing or has the wrong type.
     */
    public T decode(JSONObject payload) {
        return decoder.decode(payload);
    }

    @Override
    public String toString() {
        return "EventType{" + name + '}';
    }

    @FunctionalInterface
    public interface PayloadDecoder<T> {

        T decode(JSONObject payload);
    }
}
