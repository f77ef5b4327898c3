package io.gossipledger.core.metrics;

import io.gossipledger.core.protocol.ValidationError;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksAccepted = registry.counter("ledger.blocks.accepted");
    private static final Counter blocksMined = registry.counter("ledger.blocks.mined");
    private static final Counter chainReplaced = registry.counter("ledger.chain.replaced");
    private static final Counter chainKept = registry.counter("ledger.chain.kept");
    private static final Counter noValidChain = registry.counter("ledger.chain.no_valid");
    private static final Timer miningTime = registry.timer("ledger.mining.time");

    public static <T> T recordMining(Supplier<T> miningLogic) {
        return miningTime.record(miningLogic);
    }

    public static void incrementMined() {
        blocksMined.increment();
    }

    public static void incrementAccepted() {
        blocksAccepted.increment();
    }

    public static void incrementRejected(ValidationError reason) {
        registry.counter("ledger.blocks.rejected", "reason", reason.name().toLowerCase()).increment();
    }

    public static void incrementChainReplaced() {
        chainReplaced.increment();
    }

    public static void incrementChainKept() {
        chainKept.increment();
    }

    public static void incrementNoValidChain() {
        noValidChain.increment();
    }

    public static void incrementMessages(String kind) {
        registry.counter("gossip.messages", "kind", kind).increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append('{').append(tag.getKey()).append('=').append(tag.getValue()).append('}');
                }
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
