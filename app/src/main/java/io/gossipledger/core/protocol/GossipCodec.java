package io.gossipledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * JSON codec for the three gossip payload shapes.
 *
 * Decoding is strict: every field must be present and non-null, unknown fields are
 * rejected and numbers are never coerced from strings or floats. That strictness is
 * what keeps the shapes mutually exclusive, so the first shape that parses wins.
 */
public final class GossipCodec {
    private static final Logger LOG = Logger.getLogger(GossipCodec.class.getName());

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .build();

    private GossipCodec() {}

    /** Trial-parse in the order ChainResponse, ChainRequest, Block. Never throws for bad input. */
    public static GossipMessage decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return new GossipMessage.Unrecognized(0);
        }
        ChainResponse response = tryRead(payload, ChainResponse.class);
        if (response != null) {
            return response;
        }
        ChainRequest request = tryRead(payload, ChainRequest.class);
        if (request != null) {
            return request;
        }
        Block block = tryRead(payload, Block.class);
        if (block != null) {
            return new GossipMessage.BlockAnnouncement(block);
        }
        return new GossipMessage.Unrecognized(payload.length);
    }

    public static byte[] encode(ChainResponse response) {
        return write(response);
    }

    public static byte[] encode(ChainRequest request) {
        return write(request);
    }

    public static byte[] encode(Block block) {
        return write(block);
    }

    /** Shared mapper for callers that render ledger values (API, console). */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    private static <T> T tryRead(byte[] payload, Class<T> type) {
        try {
            return MAPPER.readValue(payload, type);
        } catch (IOException e) {
            LOG.finest(() -> "Payload is not a " + type.getSimpleName() + ": " + e.getMessage());
            return null;
        }
    }

    private static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value, e);
        }
    }
}
