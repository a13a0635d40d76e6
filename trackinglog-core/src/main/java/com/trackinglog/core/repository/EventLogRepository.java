package com.trackinglog.core.repository;

import com.trackinglog.core.model.EventLogEntry;
import java.util.List;
import java.util.Optional;

/**
 * Repository for EventLogEntry persistence.
 * Entries are append-only and immutable.
 */
public interface EventLogRepository {

    /**
     * Append a new entry to a delivery's log.
     *
     * @param entry The entry to append
     * @throws IllegalStateException if an entry already exists at (deliveryId, sequence)
     */
    void append(EventLogEntry entry);

    /**
     * Find the entry at a sequence number.
     *
     * @param deliveryId The delivery id
     * @param sequence The sequence number
     * @return The entry if written
     */
    Optional<EventLogEntry> find(long deliveryId, long sequence);

    /**
     * Get all entries for a delivery in sequence order.
     *
     * @param deliveryId The delivery id
     * @return Entries ordered by sequence number, empty if none
     */
    List<EventLogEntry> findByDelivery(long deliveryId);
}
