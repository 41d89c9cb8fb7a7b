package com.dynamicpricing.state;

import com.dynamicpricing.config.SimulatorConfig;
import com.dynamicpricing.domain.enums.HistoryScope;
import com.dynamicpricing.domain.model.EntityState;
import com.dynamicpricing.domain.model.HistoryRecord;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Capacity-bounded log of emitted city states.
 *
 * <p>Strict FIFO: once a partition holds {@code capacity} records, each append evicts its
 * oldest record. With {@link HistoryScope#GLOBAL} there is one partition for all cities;
 * with {@link HistoryScope#PER_ENTITY} each city has its own.
 *
 * <p>Ordering convention: {@link #query} returns oldest-first (emission order),
 * {@link #recent} returns newest-first.
 */
@Component
public class HistoryBuffer {

    private static final String GLOBAL_PARTITION = "*";

    private final int capacity;
    private final HistoryScope scope;
    private final Map<String, Deque<HistoryRecord>> partitions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long nextSequence = 1;

    @Autowired
    public HistoryBuffer(SimulatorConfig simulatorConfig) {
        this(simulatorConfig.getHistoryCapacity(), simulatorConfig.getHistoryScope());
    }

    public HistoryBuffer(int capacity, HistoryScope scope) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.scope = scope != null ? scope : HistoryScope.GLOBAL;
    }

    /** Appends a record, evicting the partition's oldest one when full. */
    public HistoryRecord append(long tick, EntityState state) {
        lock.writeLock().lock();
        try {
            HistoryRecord historyRecord = new HistoryRecord(nextSequence++, tick, state);
            Deque<HistoryRecord> partition =
                    partitions.computeIfAbsent(partitionKey(state.getEntityId()), k -> new ArrayDeque<>());
            if (partition.size() >= capacity) {
                partition.removeFirst();
            }
            partition.addLast(historyRecord);
            return historyRecord;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** All retained records, oldest-first. */
    public List<HistoryRecord> query() {
        return query(null, null, Integer.MAX_VALUE);
    }

    /**
     * Retained records matching the filters, oldest-first.
     *
     * @param entityId city filter, null for all cities
     * @param since    inclusive lower bound on {@code generatedAt}, null for no bound
     */
    public List<HistoryRecord> query(String entityId, Instant since) {
        return query(entityId, since, Integer.MAX_VALUE);
    }

    /**
     * The newest {@code limit} records matching the filters, returned oldest-first.
     */
    public List<HistoryRecord> query(String entityId, Instant since, int limit) {
        List<HistoryRecord> newestFirst = recent(entityId, since, limit);
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    /** The newest {@code limit} records for a city (or all cities when null), newest-first. */
    public List<HistoryRecord> recent(String entityId, int limit) {
        return recent(entityId, null, limit);
    }

    private List<HistoryRecord> recent(String entityId, Instant since, int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        lock.readLock().lock();
        try {
            List<HistoryRecord> candidates = new ArrayList<>();
            for (Deque<HistoryRecord> partition : partitionsFor(entityId)) {
                Iterator<HistoryRecord> it = partition.descendingIterator();
                int taken = 0;
                while (it.hasNext() && taken < limit) {
                    HistoryRecord historyRecord = it.next();
                    if (since != null && historyRecord.getGeneratedAt().isBefore(since)) {
                        continue;
                    }
                    if (entityId == null || entityId.equals(historyRecord.getEntityId())) {
                        candidates.add(historyRecord);
                        taken++;
                    }
                }
            }
            candidates.sort(Comparator.comparingLong(HistoryRecord::getSequence).reversed());
            return candidates.size() > limit ? new ArrayList<>(candidates.subList(0, limit)) : candidates;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return partitions.values().stream().mapToInt(Deque::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public HistoryScope getScope() {
        return scope;
    }

    private List<Deque<HistoryRecord>> partitionsFor(String entityId) {
        if (scope == HistoryScope.GLOBAL) {
            Deque<HistoryRecord> global = partitions.get(GLOBAL_PARTITION);
            return global != null ? List.of(global) : List.of();
        }
        if (entityId != null) {
            Deque<HistoryRecord> partition = partitions.get(entityId);
            return partition != null ? List.of(partition) : List.of();
        }
        return new ArrayList<>(partitions.values());
    }

    private String partitionKey(String entityId) {
        return scope == HistoryScope.GLOBAL ? GLOBAL_PARTITION : entityId;
    }
}
