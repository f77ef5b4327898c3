package io.gossipledger.core.p2p;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Active gossip group.
 *
 * Each peer is kept alive by a set of vouchers (one per live signal, e.g. one per open
 * connection). A peer joins on its first voucher and leaves only when its last voucher
 * expires, so a peer reported gone on one connection stays active while another still works.
 * Safe for concurrent updates from transport threads.
 */
public final class PeerMembership {
    private static final Logger LOG = Logger.getLogger(PeerMembership.class.getName());

    private final ConcurrentHashMap<String, Set<String>> vouchers = new ConcurrentHashMap<>();

    /** @return true if the peer was not active before this call */
    public boolean join(String peerId, String voucher) {
        AtomicBoolean added = new AtomicBoolean();
        vouchers.compute(peerId, (id, current) -> {
            Set<String> next = current == null ? new HashSet<>() : new HashSet<>(current);
            added.set(current == null);
            next.add(voucher);
            return Collections.unmodifiableSet(next);
        });
        if (added.get()) {
            LOG.info(() -> "Peer joined gossip group: " + peerId);
        }
        return added.get();
    }

    /** @return true if this was the peer's last voucher and it left the group */
    public boolean expire(String peerId, String voucher) {
        AtomicBoolean removed = new AtomicBoolean();
        vouchers.computeIfPresent(peerId, (id, current) -> {
            Set<String> next = new HashSet<>(current);
            next.remove(voucher);
            if (next.isEmpty()) {
                removed.set(true);
                return null;
            }
            return Collections.unmodifiableSet(next);
        });
        if (removed.get()) {
            LOG.info(() -> "Peer left gossip group: " + peerId);
        } else {
            LOG.fine(() -> "Peer " + peerId + " expired on " + voucher + " but is still vouched for");
        }
        return removed.get();
    }

    public boolean isActive(String peerId) {
        return vouchers.containsKey(peerId);
    }

    /** Sorted snapshot of active peer ids. */
    public Set<String> activePeers() {
        return Collections.unmodifiableSet(new TreeSet<>(vouchers.keySet()));
    }

    public int size() {
        return vouchers.size();
    }
}
