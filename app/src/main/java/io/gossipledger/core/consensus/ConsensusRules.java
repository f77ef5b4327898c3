package io.gossipledger.core.consensus;

import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.Hashes;
import io.gossipledger.core.protocol.LedgerException;
import io.gossipledger.core.protocol.ValidationError;
import io.gossipledger.core.protocol.ValidationResult;

import java.util.List;
import java.util.logging.Logger;

/**
 * Block and chain validity. Pure apart from logging.
 *
 * A block is checked against its claimed predecessor in a fixed order and the first
 * failing rule is reported: link, work, sequence, then hash integrity.
 * Index 0 of a chain is the genesis anchor and is never checked.
 */
public final class ConsensusRules {
    private static final Logger LOG = Logger.getLogger(ConsensusRules.class.getName());

    private ConsensusRules() {}

    public static ValidationResult validateBlock(Block block, Block previous) {
        if (!block.previousHash().equals(previous.hash())) {
            return reject(ValidationError.BROKEN_LINK,
                    "block with id: " + block.id() + " has wrong previous hash");
        }

        byte[] claimed;
        try {
            claimed = Hashes.fromHex(block.hash());
        } catch (LedgerException e) {
            return reject(e.error(), "block with id: " + block.id() + " has malformed hash: " + e.getMessage());
        }
        if (!ProofOfWork.satisfiesDifficulty(claimed)) {
            return reject(ValidationError.INSUFFICIENT_WORK,
                    "block with id: " + block.id() + " has invalid difficulty");
        }

        if (block.id() != previous.id() + 1) {
            return reject(ValidationError.OUT_OF_SEQUENCE,
                    "block with id: " + block.id() + " is not the next block after the latest: " + previous.id());
        }

        if (!ProofOfWork.hashOf(block).equals(block.hash())) {
            return reject(ValidationError.HASH_MISMATCH,
                    "block with id: " + block.id() + " has invalid hash");
        }
        return ValidationResult.ok();
    }

    public static boolean isBlockValid(Block block, Block previous) {
        return validateBlock(block, previous).ok;
    }

    /** Every adjacent pair from index 1 onwards must pass {@link #validateBlock}. */
    public static ValidationResult validateChain(List<Block> chain) {
        for (int i = 1; i < chain.size(); i++) {
            ValidationResult result = validateBlock(chain.get(i), chain.get(i - 1));
            if (!result.ok) {
                return ValidationResult.error(result.error, "at index " + i + ": " + result.message);
            }
        }
        return ValidationResult.ok();
    }

    public static boolean isChainValid(List<Block> chain) {
        return validateChain(chain).ok;
    }

    private static ValidationResult reject(ValidationError error, String message) {
        LOG.warning(message);
        return ValidationResult.error(error, message);
    }
}
