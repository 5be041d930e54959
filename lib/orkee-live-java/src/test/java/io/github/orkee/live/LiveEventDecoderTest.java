package io.github.orkee.live;

import io.github.orkee.live.errors.DecodeError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiveEventDecoderTest {

    private final LiveEventDecoder decoder = LiveEventDecoder.INSTANCE;

    @Test
    void decodesTypedObject() {
        LiveEvent event = decoder.decode("{\"type\":\"story_completed\",\"run_id\":\"r1\",\"story_id\":\"US-3\",\"passed\":true}");

        assertThat(event.getType()).isEqualTo("story_completed");
        assertThat(event.getString("story_id")).isEqualTo("US-3");
        assertThat(event.getPayload().get("passed").getAsBoolean()).isTrue();
    }

    @Test
    void keepsUnknownTypes() {
        LiveEvent event = decoder.decode("{\"type\":\"brand_new_event\"}");

        assertThat(event.getType()).isEqualTo("brand_new_event");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "{not json", "[1,2,3]", "\"text\"", "{}", "{\"type\":42}", "{\"type\":null}"})
    void rejectsBadFrames(String frame) {
        assertThatThrownBy(() -> decoder.decode(frame)).isInstanceOf(DecodeError.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{type: x}", "{'type':'agent_text'}", "{\"type\":\"a\"} {\"type\":\"b\"}",
            "{\"type\":\"a\",}", "{\"type\":\"a\",\"n\":NaN}"})
    void rejectsJsonThatOnlyLenientParsersAccept(String frame) {
        assertThatThrownBy(() -> decoder.decode(frame)).isInstanceOf(DecodeError.class);
    }

    @Test
    void acceptsSurroundingWhitespace() {
        assertThat(decoder.decode("  {\"type\":\"agent_text\"}\r\n").getType()).isEqualTo("agent_text");
    }

    @Test
    void rejectsNullFrame() {
        assertThatThrownBy(() -> decoder.decode(null))
                .isInstanceOf(DecodeError.class)
                .hasMessageContaining("empty frame");
    }

    @Test
    void longFramesAreShortenedInMessage() {
        String frame = "{\"no_type\":\"" + "z".repeat(500) + "\"}";

        assertThatThrownBy(() -> decoder.decode(frame))
                .isInstanceOf(DecodeError.class)
                .hasMessageContaining("frame has no type")
                .satisfies(e -> assertThat(e.getMessage()).hasSizeLessThan(200));
    }
}
