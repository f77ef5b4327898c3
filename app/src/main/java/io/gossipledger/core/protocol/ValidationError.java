package io.gossipledger.core.protocol;

/** Reasons a block, a chain or a chain adoption is refused. */
public enum ValidationError {
    BROKEN_LINK,
    INSUFFICIENT_WORK,
    OUT_OF_SEQUENCE,
    HASH_MISMATCH,
    INVALID_ENCODING,
    NO_VALID_CHAIN
}
