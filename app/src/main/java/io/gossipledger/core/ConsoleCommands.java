package io.gossipledger.core;

import io.gossipledger.core.node.MinedBlock;
import io.gossipledger.core.node.Node;
import io.gossipledger.core.protocol.Block;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Line-oriented operator commands read from stdin.
 * <pre>
 *   ls p             list active peers
 *   ls c             print the local chain
 *   create b DATA    mine a block carrying DATA and announce it
 *   sync [PEER]      request the chain of PEER, or of every active peer
 *   exit             stop the node
 * </pre>
 */
final class ConsoleCommands {
    private static final Logger LOG = Logger.getLogger(ConsoleCommands.class.getName());

    private final Node node;
    private final PrintStream out;

    ConsoleCommands(Node node, PrintStream out) {
        this.node = node;
        this.out = out;
    }

    /** Read commands until EOF or {@code exit}. */
    void run(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line)) {
                return;
            }
        }
    }

    /** Run one command. Returns false when the operator asked to stop. */
    boolean execute(String rawLine) {
        String line = rawLine == null ? "" : rawLine.trim();
        if (line.isEmpty()) {
            return true;
        }
        if (line.equals("exit") || line.equals("quit")) {
            return false;
        }
        if (line.equals("ls p")) {
            out.println("Discovered Peers:");
            node.membership().activePeers().forEach(out::println);
        } else if (line.equals("ls c")) {
            out.println("Local Blockchain:");
            for (Block block : node.chain().snapshot()) {
                out.println(block);
            }
        } else if (line.startsWith("create b")) {
            String data = line.substring("create b".length()).trim();
            if (data.isEmpty()) {
                out.println("usage: create b <data>");
            } else {
                createBlock(data);
            }
        } else if (line.equals("sync") || line.startsWith("sync ")) {
            String peer = line.substring("sync".length()).trim();
            int sent = peer.isEmpty() ? node.requestChainFromAll() : node.requestChain(peer);
            out.println("chain request published to " + sent + " peer(s)");
        } else if (line.equals("help")) {
            out.println("commands: ls p | ls c | create b <data> | sync [peer] | exit");
        } else {
            out.println("unknown command: " + line);
        }
        return true;
    }

    private void createBlock(String data) {
        try {
            Optional<MinedBlock> mined = node.mine(data).get();
            if (mined.isEmpty()) {
                out.println("mining gave up, try again");
            } else if (mined.get().accepted()) {
                out.println("created " + mined.get().block() + ", announced to " + mined.get().announcedTo() + " peer(s)");
            } else {
                out.println("mined block was rejected: " + mined.get().result());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("interrupted while mining");
        } catch (ExecutionException e) {
            LOG.log(Level.WARNING, "Mining failed", e.getCause());
            out.println("mining failed: " + e.getCause().getMessage());
        }
    }
}
