package com.trackinglog.engine.persistence;

import com.trackinglog.core.model.EventLogEntry;
import com.trackinglog.core.repository.EventLogRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of EventLogRepository.
 * One sequence-ordered map per delivery; existing keys are never overwritten.
 */
@Repository
public class InMemoryEventLogRepository implements EventLogRepository {

    private final Map<Long, NavigableMap<Long, EventLogEntry>> logs = new ConcurrentHashMap<>();

    @Override
    public void append(EventLogEntry entry) {
        NavigableMap<Long, EventLogEntry> log =
            logs.computeIfAbsent(entry.deliveryId(), id -> new ConcurrentSkipListMap<>());
        EventLogEntry existing = log.putIfAbsent(entry.sequence(), entry);
        if (existing != null) {
            throw new IllegalStateException(String.format(
                "Event log entry already written: delivery %d sequence %d",
                entry.deliveryId(), entry.sequence()));
        }
    }

    @Override
    public Optional<EventLogEntry> find(long deliveryId, long sequence) {
        NavigableMap<Long, EventLogEntry> log = logs.get(deliveryId);
        return log == null ? Optional.empty() : Optional.ofNullable(log.get(sequence));
    }

    @Override
    public List<EventLogEntry> findByDelivery(long deliveryId) {
        NavigableMap<Long, EventLogEntry> log = logs.get(deliveryId);
        return log == null ? List.of() : List.copyOf(log.values());
    }
}
