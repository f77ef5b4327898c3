package io.gossipledger.core.protocol;

import java.util.Objects;

/**
 * Decoded form of an inbound gossip payload.
 * The wire carries no discriminator; {@link GossipCodec#decode(byte[])} picks the variant by shape.
 */
public interface GossipMessage {

    /** Kind label used for logging and metrics. */
    String kind();

    /** A freshly mined block pushed by a peer. */
    record BlockAnnouncement(Block block) implements GossipMessage {
        public BlockAnnouncement {
            Objects.requireNonNull(block, "block");
        }

        @Override public String kind() { return "block"; }
    }

    /** Payload that matched none of the known shapes. */
    record Unrecognized(int length) implements GossipMessage {
        @Override public String kind() { return "unrecognized"; }
    }
}
