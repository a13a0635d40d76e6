package com.trackinglog.core.repository;

import com.trackinglog.core.model.DeliveryRecord;
import java.util.Optional;

/**
 * Repository for DeliveryRecord persistence.
 * Records are created once and never deleted. Callers hold the delivery lock.
 */
public interface DeliveryRecordRepository {

    /**
     * Save a new delivery record.
     *
     * @param record The record to save
     * @throws IllegalStateException if a record with the same id exists
     */
    void save(DeliveryRecord record);

    /**
     * Replace an existing delivery record.
     *
     * @param record The updated record
     * @throws IllegalStateException if no record with that id exists
     */
    void update(DeliveryRecord record);

    /**
     * Find a delivery record by id.
     *
     * @param deliveryId The delivery id
     * @return The record if found
     */
    Optional<DeliveryRecord> findById(long deliveryId);

    /**
     * Check whether a record exists for the id.
     */
    boolean existsById(long deliveryId);

    /**
     * Total number of delivery records.
     */
    long count();
}
