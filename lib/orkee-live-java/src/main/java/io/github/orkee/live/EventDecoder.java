package io.github.orkee.live;

import io.github.orkee.live.errors.DecodeError;

/**
 * Decodes one raw stream frame into an event.
 *
 * @param <E> the event type
 */
@FunctionalInterface
public interface EventDecoder<E> {

    /**
     * Decodes a frame.
     *
     * @param frame the raw frame text
     * @return the event
     * @throws DecodeError if the frame is malformed
     */
    E decode(String frame);
}
