package io.gossipledger.core;

import io.gossipledger.core.node.Node;
import io.gossipledger.core.node.NodeConfig;
import io.gossipledger.core.node.PeerIdentity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleCommandsTest {

    private Node node;
    private ByteArrayOutputStream buffer;
    private ConsoleCommands console;

    @BeforeEach
    void setUp() {
        node = Node.inMemory(NodeConfig.defaultLocal().withIdentity(new PeerIdentity("console-node")));
        node.start();
        buffer = new ByteArrayOutputStream();
        console = new ConsoleCommands(node, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        node.close();
    }

    @Test
    void listsPeersAndChain() {
        node.membership().join("peer-z", "conn-1");

        assertTrue(console.execute("ls p"));
        assertTrue(console.execute("ls c"));

        String out = output();
        assertTrue(out.contains("Discovered Peers:"));
        assertTrue(out.contains("peer-z"));
        assertTrue(out.contains("Local Blockchain:"));
        assertTrue(out.contains("data=genesis!"));
    }

    @Test
    void createBlockMinesOnTopOfLedger() {
        assertTrue(console.execute("create b hello console"));

        assertEquals(2, node.chain().size());
        assertEquals("hello console", node.chain().last().orElseThrow().data());
        assertTrue(output().contains("created Block{id=1"));
    }

    @Test
    void createBlockWithoutDataPrintsUsage() {
        assertTrue(console.execute("create b"));
        assertEquals(1, node.chain().size());
        assertTrue(output().contains("usage: create b <data>"));
    }

    @Test
    void syncPublishesThroughTransport() {
        AtomicInteger published = new AtomicInteger();
        node.bindTransport((topic, payload) -> {
            published.incrementAndGet();
            return 1;
        });
        node.membership().join("peer-a", "c1");

        assertTrue(console.execute("sync"));
        assertTrue(console.execute("sync peer-b"));

        assertEquals(2, published.get());
        assertTrue(output().contains("chain request published to 1 peer(s)"));
    }

    @Test
    void unknownCommandIsReported() {
        assertTrue(console.execute("frobnicate"));
        assertTrue(output().contains("unknown command: frobnicate"));
    }

    @Test
    void runStopsAtExit() throws Exception {
        BufferedReader in = new BufferedReader(new StringReader("ls p\nexit\ncreate b never\n"));
        console.run(in);
        assertEquals(1, node.chain().size());
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
