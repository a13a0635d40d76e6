package com.trackinglog.engine.persistence;

import com.trackinglog.core.model.DeliveryRecord;
import com.trackinglog.core.repository.DeliveryRecordRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of DeliveryRecordRepository.
 */
@Repository
public class InMemoryDeliveryRecordRepository implements DeliveryRecordRepository {

    private final Map<Long, DeliveryRecord> records = new ConcurrentHashMap<>();

    @Override
    public void save(DeliveryRecord record) {
        DeliveryRecord existing = records.putIfAbsent(record.deliveryId(), record);
        if (existing != null) {
            throw new IllegalStateException("Delivery record already exists: " + record.deliveryId());
        }
    }

    @Override
    public void update(DeliveryRecord record) {
        DeliveryRecord previous = records.computeIfPresent(record.deliveryId(), (id, old) -> record);
        if (previous == null) {
            throw new IllegalStateException("Delivery record does not exist: " + record.deliveryId());
        }
    }

    @Override
    public Optional<DeliveryRecord> findById(long deliveryId) {
        return Optional.ofNullable(records.get(deliveryId));
    }

    @Override
    public boolean existsById(long deliveryId) {
        return records.containsKey(deliveryId);
    }

    @Override
    public long count() {
        return records.size();
    }
}
