package com.demo.companion.infrastructure;

import com.demo.companion.domain.GroupEnvelope;

import java.util.function.Consumer;

/**
 * Mirrors group emissions to the other instances. Never authoritative: the
 * local registry is always delivered to first, the relay only adds reach.
 */
public interface BroadcastRelay {

    boolean isEnabled();

    /**
     * Publish an envelope for other instances. Implementations stamp the
     * origin node and must not deliver it back to this instance.
     */
    void publish(GroupEnvelope envelope);

    /**
     * Register a consumer for envelopes published by other instances.
     */
    void subscribe(Consumer<GroupEnvelope> consumer);
}
