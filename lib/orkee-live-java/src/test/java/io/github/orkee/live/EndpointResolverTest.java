package io.github.orkee.live;

import io.github.orkee.live.errors.LiveException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointResolverTest {

    @Test
    void trailingSlashIsRemoved() {
        EndpointResolver resolver = new EndpointResolver("http://localhost:4001/", null);

        assertThat(resolver.getBaseUrl()).isEqualTo("http://localhost:4001");
        assertThat(resolver.resource("/api/agent-runs/r1").toString()).isEqualTo("http://localhost:4001/api/agent-runs/r1");
    }

    @Test
    void eventsWithoutToken() {
        EndpointResolver resolver = new EndpointResolver("http://localhost:4001", () -> null);

        assertThat(resolver.token()).isEmpty();
        assertThat(resolver.events("/api/preview").toString()).isEqualTo("http://localhost:4001/api/preview/events");
    }

    @Test
    void eventsCarryEncodedToken() {
        EndpointResolver resolver = new EndpointResolver("http://localhost:4001", () -> "a+b/c=");

        assertThat(resolver.events("/api/agent-runs/r1").toString())
                .isEqualTo("http://localhost:4001/api/agent-runs/r1/events?token=a%2Bb%2Fc%3D");
    }

    @Test
    void emptyTokenCountsAsNone() {
        EndpointResolver resolver = new EndpointResolver("http://localhost:4001", () -> "");

        assertThat(resolver.token()).isEmpty();
        assertThat(resolver.events("/x").getQuery()).isNull();
    }

    @Test
    void tokenIsReadOnEveryCall() {
        AtomicReference<String> token = new AtomicReference<>("first");
        EndpointResolver resolver = new EndpointResolver("http://localhost:4001", token::get);

        assertThat(resolver.events("/x").getQuery()).isEqualTo("token=first");
        token.set("second");
        assertThat(resolver.events("/x").getQuery()).isEqualTo("token=second");
    }

    @Test
    void encodePathKeepsSlashesAndEncodesSpaces() {
        assertThat(EndpointResolver.encodePath("run 1")).isEqualTo("run%201");
        assertThat(EndpointResolver.encodePath("a/b c")).isEqualTo("a/b%20c");
        assertThat(EndpointResolver.encodePath("id?x=1")).isEqualTo("id%3Fx%3D1");
    }

    @Test
    void emptyBaseUrlIsRejected() {
        assertThatThrownBy(() -> new EndpointResolver("", null))
                .isInstanceOf(LiveException.class)
                .hasMessageContaining("baseUrl cannot be empty");
    }
}
