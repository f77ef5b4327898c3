package io.gossipledger.core.node;

import io.gossipledger.core.TestChains;
import io.gossipledger.core.consensus.ConsensusRules;
import io.gossipledger.core.p2p.PeerMembership;
import io.gossipledger.core.p2p.Topic;
import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.ChainRequest;
import io.gossipledger.core.protocol.GossipCodec;
import io.gossipledger.core.protocol.GossipMessage;
import io.gossipledger.core.protocol.ValidationError;
import io.gossipledger.core.protocol.ValidationResult;
import io.gossipledger.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private Node node;

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.close();
        }
    }

    @Test
    void startSeedsGenesis() {
        node = Node.inMemory(NodeConfig.defaultLocal());
        node.start();
        node.start();
        assertEquals(List.of(GenesisBlock.get()), node.chain().snapshot());
    }

    @Test
    void minedBlockIsAppendedAndAnnounced() throws Exception {
        node = Node.inMemory(NodeConfig.defaultLocal().withIdentity(new PeerIdentity("miner")));
        node.start();
        List<Topic> topics = new CopyOnWriteArrayList<>();
        node.bindTransport((topic, payload) -> {
            topics.add(topic);
            return 2;
        });

        Optional<MinedBlock> mined = node.mine("first").get(60, TimeUnit.SECONDS);

        assertTrue(mined.isPresent());
        MinedBlock result = mined.get();
        assertTrue(result.accepted());
        assertEquals(2, result.announcedTo());
        assertEquals(1, result.block().id());
        assertEquals("first", result.block().data());
        assertEquals(2, node.chain().size());
        assertTrue(ConsensusRules.isChainValid(node.chain().snapshot()));
        assertEquals(List.of(node.config().blockTopic), topics);
    }

    @Test
    void minerThatGivesUpCompletesEmpty() throws Exception {
        NodeConfig config = NodeConfig.defaultLocal();
        node = new Node(config, new InMemoryChainStore(), new PeerMembership(), new BlockMiner(0));
        node.start();

        Optional<MinedBlock> mined = node.mine("never").get(10, TimeUnit.SECONDS);

        assertTrue(mined.isEmpty());
        assertEquals(1, node.chain().size());
    }

    @Test
    void submittedPayloadsAreProcessedInOrder() throws Exception {
        node = Node.inMemory(NodeConfig.defaultLocal());
        node.start();
        List<Block> chain = TestChains.mainChain();

        node.submit("peer", GossipCodec.encode(chain.get(1)));
        node.submit("peer", GossipCodec.encode(chain.get(2)));
        GossipMessage last = node.submit("peer", GossipCodec.encode(chain.get(3))).get(10, TimeUnit.SECONDS);

        assertInstanceOf(GossipMessage.BlockAnnouncement.class, last);
        assertEquals(chain, node.chain().snapshot());
    }

    @Test
    void submitBlockReportsRejection() throws Exception {
        node = Node.inMemory(NodeConfig.defaultLocal());
        node.start();

        ValidationResult result = node.submitBlock("peer", TestChains.mainChain().get(2)).get(10, TimeUnit.SECONDS);

        assertEquals(ValidationError.BROKEN_LINK, result.error);
        assertEquals(1, node.chain().size());
    }

    @Test
    void requestChainFromAllAsksEveryActivePeer() {
        node = Node.inMemory(NodeConfig.defaultLocal());
        node.start();
        List<byte[]> sent = new CopyOnWriteArrayList<>();
        node.bindTransport((topic, payload) -> {
            sent.add(payload);
            return 1;
        });
        node.membership().join("peer-a", "c1");
        node.membership().join("peer-b", "c2");

        assertEquals(2, node.requestChainFromAll());
        assertArrayEquals(GossipCodec.encode(new ChainRequest("peer-a")), sent.get(0));
        assertArrayEquals(GossipCodec.encode(new ChainRequest("peer-b")), sent.get(1));
    }
}
