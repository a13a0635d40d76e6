package com.trackinglog.engine.registry;

import com.trackinglog.core.exception.PausedException;
import com.trackinglog.core.exception.UnauthorizedException;
import com.trackinglog.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global owner identity and pause switch.
 * The owner is fixed at startup. Pausing blocks delivery creation and logging;
 * pause and unpause themselves are never gated.
 */
public class AdminControl {

    private static final Logger log = LoggerFactory.getLogger(AdminControl.class);

    private final String owner;
    private final AtomicBoolean paused = new AtomicBoolean(false);

    public AdminControl(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner identity cannot be empty");
        }
        this.owner = owner;
    }

    public String owner() {
        return owner;
    }

    public boolean isOwner(String identity) {
        return owner.equals(identity);
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Set the pause flag. Owner only.
     */
    public void pause(String caller) {
        try (var ctx = LoggingContext.forAdmin(caller, "pause")) {
            requireOwner(caller, "pause the ledger");
            if (paused.compareAndSet(false, true)) {
                log.info("Ledger paused");
            }
        }
    }

    /**
     * Clear the pause flag. Owner only.
     */
    public void unpause(String caller) {
        try (var ctx = LoggingContext.forAdmin(caller, "unpause")) {
            requireOwner(caller, "unpause the ledger");
            if (paused.compareAndSet(true, false)) {
                log.info("Ledger unpaused");
            }
        }
    }

    /**
     * @throws PausedException if the pause flag is set
     */
    public void requireNotPaused() {
        if (paused.get()) {
            throw new PausedException();
        }
    }

    /**
     * @throws UnauthorizedException if the caller is not the owner
     */
    public void requireOwner(String caller, String action) {
        if (!isOwner(caller)) {
            log.warn("Rejected non-owner attempt to {}", action);
            throw new UnauthorizedException(caller, action);
        }
    }
}
