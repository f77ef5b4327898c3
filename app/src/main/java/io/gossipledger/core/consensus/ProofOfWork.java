package io.gossipledger.core.consensus;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.Hashes;

import java.util.Optional;

/**
 * Content hashing and the proof-of-work admission rule.
 * <ul>
 *   <li>Hash = SHA-256 of the compact JSON object
 *   {@code {"data":..,"id":..,"nonce":..,"previous_hash":..,"timestamp":..}} (keys sorted).</li>
 *   <li>A hash satisfies the difficulty when its first {@link #DIFFICULTY_BITS} bits are zero.</li>
 * </ul>
 *
 * Example: 16 bits -> the hex form starts with "0000".
 *
 * Control characters without a short escape are written as six-character escapes with lower-case hex,
 * so the digest is stable across peers serializing the same block.
 */
public final class ProofOfWork {

    /** Required leading zero bits. Fixed for the whole network. */
    public static final int DIFFICULTY_BITS = 16;

    private static final ObjectMapper JSON = new ObjectMapper(new JsonFactoryBuilder()
            .characterEscapes(new LowerHexControlEscapes())
            .build());

    private ProofOfWork() {}

    /** Deterministic digest over the five hashed fields of a block. */
    public static byte[] computeHash(long id, long timestamp, String previousHash, String data, long nonce) {
        ObjectNode canonical = JSON.createObjectNode();
        canonical.put("data", data);
        canonical.put("id", id);
        canonical.put("nonce", nonce);
        canonical.put("previous_hash", previousHash);
        canonical.put("timestamp", timestamp);
        try {
            return Hashes.sha256(JSON.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize block fields", e);
        }
    }

    /** Hex form of {@link #computeHash} for the block's own fields. */
    public static String hashOf(Block block) {
        return Hashes.toHex(computeHash(block.id(), block.timestamp(), block.previousHash(), block.data(), block.nonce()));
    }

    /** Does this digest start with the required run of zero bits? */
    public static boolean satisfiesDifficulty(byte[] digest) {
        return hasLeadingZeroBits(digest, DIFFICULTY_BITS);
    }

    /**
     * Search nonces starting at the template's nonce, up to maxTries attempts.
     * Returns a NEW block carrying the winning nonce and its hash, or empty if none was found.
     * Only the nonce varies; id, timestamp, previous hash and data are taken from the template.
     */
    public static Optional<Block> mine(Block template, long maxTries) {
        if (template == null) return Optional.empty();

        long nonce = template.nonce();
        for (long i = 0; i < maxTries && nonce >= 0; i++, nonce++) {
            byte[] hash = computeHash(template.id(), template.timestamp(), template.previousHash(), template.data(), nonce);
            if (satisfiesDifficulty(hash)) {
                return Optional.of(new Block(
                        template.id(),
                        Hashes.toHex(hash),
                        template.previousHash(),
                        template.timestamp(),
                        template.data(),
                        nonce
                ));
            }
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        return Optional.empty();
    }

    // ---------- helpers ----------

    /**
     * Check for N leading zero bits in the hash.
     * Fast path: count whole zero bytes, then the first non-zero byte's leading zeros.
     */
    static boolean hasLeadingZeroBits(byte[] hash, int requiredBits) {
        if (requiredBits <= 0) return true;
        if (hash == null || requiredBits > hash.length * 8) return false;

        int fullBytes = requiredBits / 8;
        int remBits = requiredBits % 8;

        for (int i = 0; i < fullBytes; i++) {
            if (hash[i] != 0) return false;
        }
        if (remBits == 0) return true;

        int next = hash[fullBytes] & 0xff;
        return Integer.numberOfLeadingZeros(next) - 24 >= remBits;
    }

    private static final class LowerHexControlEscapes extends CharacterEscapes {
        private final int[] asciiEscapes;

        LowerHexControlEscapes() {
            int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int ch = 0; ch < 0x20; ch++) {
                // \b \t \n \f \r keep their short form
                if (escapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
                    escapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
            this.asciiEscapes = escapes;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return new SerializedString(String.format("\\u%04x", ch));
        }
    }
}
