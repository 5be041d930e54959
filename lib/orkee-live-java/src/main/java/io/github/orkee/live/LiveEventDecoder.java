package io.github.orkee.live;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.github.orkee.live.errors.DecodeError;

import java.io.IOException;
import java.io.StringReader;

/**
 * Decodes JSON object frames that carry a string {@code type} field.
 * Frames are parsed strictly: unquoted names, single quotes and trailing data are rejected.
 */
public final class LiveEventDecoder implements EventDecoder<LiveEvent> {

    /** shared stateless instance */
    public static final LiveEventDecoder INSTANCE = new LiveEventDecoder();

    private static final int PREVIEW_LENGTH = 100;

    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = new Gson().getAdapter(JsonElement.class);

    private LiveEventDecoder() {
    }

    @Override
    public LiveEvent decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new DecodeError("empty frame");
        }

        JsonElement element;
        try (JsonReader reader = new JsonReader(new StringReader(frame))) {
            reader.setLenient(false);
            element = ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new DecodeError("trailing data after JSON: " + preview(frame));
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new DecodeError("malformed JSON: " + preview(frame), e);
        }
        if (!element.isJsonObject()) {
            throw new DecodeError("frame is not a JSON object: " + preview(frame));
        }

        JsonObject object = element.getAsJsonObject();
        JsonElement type = object.get("type");
        if (type == null || !type.isJsonPrimitive() || !type.getAsJsonPrimitive().isString()) {
            throw new DecodeError("frame has no type: " + preview(frame));
        }
        return new LiveEvent(type.getAsString(), object);
    }

    private static String preview(String frame) {
        return frame.length() <= PREVIEW_LENGTH ? frame : frame.substring(0, PREVIEW_LENGTH) + "...";
    }
}
