package io.github.orkee.live;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * Event received on a live stream.
 * <p>
 * Only the {@code type} discriminator is interpreted; the rest of the JSON object is
 * carried as an opaque payload. Unknown types are kept, not rejected.
 */
public final class LiveEvent {

    private final String type;
    private final JsonObject payload;

    /**
     * Creates a new live event.
     *
     * @param type    the event type, e.g. {@code run_completed}
     * @param payload the full JSON object of the frame, including {@code type}
     */
    public LiveEvent(String type, JsonObject payload) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.payload = payload == null ? new JsonObject() : payload.deepCopy();
    }

    /**
     * Returns the event type.
     *
     * @return the type discriminator
     */
    public String getType() {
        return type;
    }

    /**
     * Returns a copy of the JSON payload.
     *
     * @return the payload
     */
    public JsonObject getPayload() {
        return payload.deepCopy();
    }

    /**
     * Returns a string field of the payload.
     *
     * @param field the field name
     * @return the value, or null if absent or not a string
     */
    public String getString(String field) {
        JsonElement element = payload.get(field);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return null;
        }
        return element.getAsString();
    }

    /**
     * Checks if the event has the given type.
     *
     * @param candidate the type to compare
     * @return true if the types are equal
     */
    public boolean is(String candidate) {
        return type.equals(candidate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LiveEvent that = (LiveEvent) o;
        return type.equals(that.type) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return "LiveEvent{" +
                "type='" + type + '\'' +
                ", payload=" + payload +
                '}';
    }
}
