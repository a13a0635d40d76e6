package com.trackinglog.engine.registry;

import com.trackinglog.core.exception.OracleCapacityExceededException;
import com.trackinglog.core.model.LedgerLimits;
import com.trackinglog.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Global allowlist of trusted automated updaters.
 * Entries written by an oracle are marked verified. Owner-mutable only.
 */
public class OracleRegistry {

    private static final Logger log = LoggerFactory.getLogger(OracleRegistry.class);

    private final AdminControl adminControl;
    private final List<String> oracles = new ArrayList<>();

    public OracleRegistry(AdminControl adminControl) {
        this.adminControl = adminControl;
    }

    public boolean isOracle(String identity) {
        synchronized (oracles) {
            return oracles.contains(identity);
        }
    }

    /**
     * Append an identity. Duplicates are not checked and count against capacity.
     */
    public void addOracle(String caller, String identity) {
        try (var ctx = LoggingContext.forAdmin(caller, "addOracle")) {
            adminControl.requireOwner(caller, "add oracles");
            synchronized (oracles) {
                if (oracles.size() >= LedgerLimits.MAX_ORACLES) {
                    log.warn("Oracle registry full, rejected {}", identity);
                    throw new OracleCapacityExceededException(LedgerLimits.MAX_ORACLES);
                }
                oracles.add(identity);
            }
            log.info("Oracle added: {}", identity);
        }
    }

    /**
     * Remove every occurrence of an identity. Absent identities are a no-op.
     */
    public void removeOracle(String caller, String identity) {
        try (var ctx = LoggingContext.forAdmin(caller, "removeOracle")) {
            adminControl.requireOwner(caller, "remove oracles");
            boolean removed;
            synchronized (oracles) {
                removed = oracles.removeIf(o -> o.equals(identity));
            }
            if (removed) {
                log.info("Oracle removed: {}", identity);
            } else {
                log.debug("Oracle not registered, nothing removed: {}", identity);
            }
        }
    }

    /**
     * Snapshot of registered oracles in insertion order.
     */
    public List<String> oracles() {
        synchronized (oracles) {
            return List.copyOf(oracles);
        }
    }
}
