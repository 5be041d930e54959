package io.github.orkee.live;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiveEventTest {

    @Test
    void constructorAndGetters() {
        JsonObject payload = new JsonObject();
        payload.addProperty("type", "iteration_failed");
        payload.addProperty("run_id", "run-1");
        payload.addProperty("iteration", 3);

        LiveEvent event = new LiveEvent("iteration_failed", payload);

        assertThat(event.getType()).isEqualTo("iteration_failed");
        assertThat(event.is("iteration_failed")).isTrue();
        assertThat(event.is("run_failed")).isFalse();
        assertThat(event.getString("run_id")).isEqualTo("run-1");
        assertThat(event.getString("iteration")).isNull();
        assertThat(event.getString("missing")).isNull();
        assertThat(event.getPayload().get("iteration").getAsInt()).isEqualTo(3);
    }

    @Test
    void payloadIsCopied() {
        JsonObject payload = new JsonObject();
        payload.addProperty("text", "before");
        LiveEvent event = new LiveEvent("agent_text", payload);

        payload.addProperty("text", "after");
        event.getPayload().addProperty("text", "changed");

        assertThat(event.getString("text")).isEqualTo("before");
    }

    @Test
    void nullPayloadBecomesEmpty() {
        LiveEvent event = new LiveEvent("heartbeat", null);

        assertThat(event.getPayload().size()).isZero();
    }

    @Test
    void typeIsRequired() {
        assertThatThrownBy(() -> new LiveEvent(null, new JsonObject()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void equalsAndHashCode() {
        JsonObject payload = new JsonObject();
        payload.addProperty("n", 1);

        LiveEvent event1 = new LiveEvent("a", payload);
        LiveEvent event2 = new LiveEvent("a", payload);
        LiveEvent event3 = new LiveEvent("b", payload);

        assertThat(event1).isEqualTo(event2);
        assertThat(event1.hashCode()).isEqualTo(event2.hashCode());
        assertThat(event1).isNotEqualTo(event3);
    }

    @Test
    void toStringContainsTypeAndPayload() {
        JsonObject payload = new JsonObject();
        payload.addProperty("run_id", "run-9");

        String str = new LiveEvent("run_completed", payload).toString();
        assertThat(str).contains("type='run_completed'");
        assertThat(str).contains("run-9");
    }
}
