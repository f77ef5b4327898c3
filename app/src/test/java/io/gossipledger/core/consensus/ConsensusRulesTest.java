package io.gossipledger.core.consensus;

import io.gossipledger.core.TestChains;
import io.gossipledger.core.node.GenesisBlock;
import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.ValidationError;
import io.gossipledger.core.protocol.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusRulesTest {

    @Test
    void acceptsMinedSuccessor() {
        List<Block> chain = TestChains.mainChain();
        ValidationResult result = ConsensusRules.validateBlock(chain.get(1), chain.get(0));
        assertTrue(result.ok, result.toString());
        assertTrue(ConsensusRules.isBlockValid(chain.get(2), chain.get(1)));
    }

    @Test
    void rejectsWrongPreviousHash() {
        List<Block> chain = TestChains.mainChain();
        ValidationResult result = ConsensusRules.validateBlock(chain.get(2), chain.get(0));
        assertFalse(result.ok);
        assertEquals(ValidationError.BROKEN_LINK, result.error);
    }

    @Test
    void rejectsInsufficientWork() {
        Block genesis = GenesisBlock.get();
        Block weak = weakBlock(genesis, "weak");
        ValidationResult result = ConsensusRules.validateBlock(weak, genesis);
        assertFalse(result.ok);
        assertEquals(ValidationError.INSUFFICIENT_WORK, result.error);
    }

    @Test
    void rejectsOutOfSequenceId() {
        Block genesis = GenesisBlock.get();
        Block skipped = TestChains.mineAt(2, genesis.hash(), TestChains.BASE_TIMESTAMP, "skipped");
        ValidationResult result = ConsensusRules.validateBlock(skipped, genesis);
        assertFalse(result.ok);
        assertEquals(ValidationError.OUT_OF_SEQUENCE, result.error);
    }

    @Test
    void rejectsTamperedContent() {
        List<Block> chain = TestChains.mainChain();
        Block b1 = chain.get(1);
        Block tampered = new Block(b1.id(), b1.hash(), b1.previousHash(), b1.timestamp(), "tampered", b1.nonce());
        ValidationResult result = ConsensusRules.validateBlock(tampered, chain.get(0));
        assertFalse(result.ok);
        assertEquals(ValidationError.HASH_MISMATCH, result.error);
    }

    @Test
    void malformedHexIsReportedNotThrown() {
        Block genesis = GenesisBlock.get();
        Block b1 = TestChains.mainChain().get(1);

        ValidationResult badChar = ConsensusRules.validateBlock(withHash(b1, "zz" + b1.hash().substring(2)), genesis);
        assertEquals(ValidationError.INVALID_ENCODING, badChar.error);

        ValidationResult oddLength = ConsensusRules.validateBlock(withHash(b1, b1.hash().substring(1)), genesis);
        assertEquals(ValidationError.INVALID_ENCODING, oddLength.error);
    }

    @Test
    void linkIsCheckedBeforeWork() {
        Block genesis = GenesisBlock.get();
        Block unlinkedAndWeak = new Block(1, "ff" + "00".repeat(31), "somewhere-else", 1L, "x", 0L);
        assertEquals(ValidationError.BROKEN_LINK, ConsensusRules.validateBlock(unlinkedAndWeak, genesis).error);
    }

    @Test
    void workIsCheckedBeforeSequence() {
        Block genesis = GenesisBlock.get();
        Block weak = weakBlock(genesis, "weak");
        Block weakAndSkipped = new Block(5, weak.hash(), weak.previousHash(), weak.timestamp(), weak.data(), weak.nonce());
        assertEquals(ValidationError.INSUFFICIENT_WORK, ConsensusRules.validateBlock(weakAndSkipped, genesis).error);
    }

    @Test
    void sequenceIsCheckedBeforeHashIntegrity() {
        Block genesis = GenesisBlock.get();
        Block b1 = TestChains.mainChain().get(1);
        Block renumbered = new Block(9, b1.hash(), b1.previousHash(), b1.timestamp(), b1.data(), b1.nonce());
        assertEquals(ValidationError.OUT_OF_SEQUENCE, ConsensusRules.validateBlock(renumbered, genesis).error);
    }

    @Test
    void emptyAndGenesisOnlyChainsAreValid() {
        assertTrue(ConsensusRules.isChainValid(List.of()));
        assertTrue(ConsensusRules.isChainValid(List.of(GenesisBlock.get())));
    }

    @Test
    void genesisAtIndexZeroIsNeverChecked() {
        Block bogusAnchor = new Block(0, "not-even-hex", "genesis", 0L, "anything", 0L);
        assertTrue(ConsensusRules.isChainValid(List.of(bogusAnchor)));
    }

    @Test
    void fullMainChainIsValid() {
        assertTrue(ConsensusRules.isChainValid(TestChains.mainChain()));
        assertTrue(ConsensusRules.isChainValid(TestChains.forkChain()));
    }

    @Test
    void mutatingAnyBlockInvalidatesTheChain() {
        List<Block> chain = TestChains.mainChain();
        Block b2 = chain.get(2);

        List<Block> dataChanged = replace(chain, 2,
                new Block(b2.id(), b2.hash(), b2.previousHash(), b2.timestamp(), "changed", b2.nonce()));
        ValidationResult result = ConsensusRules.validateChain(dataChanged);
        assertEquals(ValidationError.HASH_MISMATCH, result.error);
        assertTrue(result.message.contains("index 2"));

        List<Block> nonceChanged = replace(chain, 2,
                new Block(b2.id(), b2.hash(), b2.previousHash(), b2.timestamp(), b2.data(), b2.nonce() + 1));
        assertFalse(ConsensusRules.isChainValid(nonceChanged));

        List<Block> relinked = replace(chain, 2,
                new Block(b2.id(), b2.hash(), "ff" + b2.previousHash().substring(2), b2.timestamp(), b2.data(), b2.nonce()));
        assertEquals(ValidationError.BROKEN_LINK, ConsensusRules.validateChain(relinked).error);
    }

    @Test
    void mixingBranchesBreaksTheLink() {
        List<Block> mixed = new ArrayList<>(TestChains.mainPrefix(2));
        mixed.add(TestChains.forkChain().get(2));
        ValidationResult result = ConsensusRules.validateChain(mixed);
        assertEquals(ValidationError.BROKEN_LINK, result.error);
    }

    private static List<Block> replace(List<Block> chain, int index, Block block) {
        List<Block> copy = new ArrayList<>(chain);
        copy.set(index, block);
        return copy;
    }

    /** A correctly linked and hashed block whose hash does not meet the difficulty. */
    private static Block weakBlock(Block parent, String data) {
        long nonce = 0;
        while (true) {
            Block candidate = new Block(parent.id() + 1, "", parent.hash(), TestChains.BASE_TIMESTAMP, data, nonce);
            String hash = ProofOfWork.hashOf(candidate);
            if (!hash.startsWith("0000")) {
                return withHash(candidate, hash);
            }
            nonce++;
        }
    }

    private static Block withHash(Block block, String hash) {
        return new Block(block.id(), hash, block.previousHash(), block.timestamp(), block.data(), block.nonce());
    }
}
