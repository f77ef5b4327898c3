package io.gossipledger.core.p2p;

/** Outbound side of the transport: fire-and-forget broadcast to the current peer group. */
public interface GossipPublisher {

    /**
     * Broadcast an opaque payload on a topic.
     *
     * @return number of peers the payload was handed to (0 when nobody is connected)
     */
    int publish(Topic topic, byte[] payload);
}
