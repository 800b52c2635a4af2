package com.company.jobmonitor.store;

import com.company.jobmonitor.domain.JobTrackingRecord;
import com.company.jobmonitor.domain.enums.JobHealthState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory tracking records keyed by job id, one lock per job.
 * <p>
 * Records returned by {@link #getOrCreate(String)} are live and must only be read
 * or written inside {@link #withLock(String, Supplier)} for the same job. Different
 * jobs never contend with each other.
 */
@Component
@Slf4j
public class JobTrackingStore {

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile JobTrackingRecord record;
        /** Health state as of the last replace; readable without the lock. */
        private volatile JobHealthState healthState;
    }

    /**
     * Runs {@code action} holding the job's lock, so the read-decide-write sequence
     * of a check is never interleaved with another check of the same job.
     */
    public <T> T withLock(String jobId, Supplier<T> action) {
        Slot slot = slot(jobId);
        slot.lock.lock();
        try {
            return action.get();
        } finally {
            slot.lock.unlock();
        }
    }

    public JobTrackingRecord getOrCreate(String jobId) {
        Slot slot = slot(jobId);
        slot.lock.lock();
        try {
            if (slot.record == null) {
                slot.record = JobTrackingRecord.initial(jobId);
                slot.healthState = slot.record.getHealthState();
                log.debug("Created tracking record for job {}", jobId);
            }
            return slot.record;
        } finally {
            slot.lock.unlock();
        }
    }

    /** Replaces the job's record with {@code record}. Caller holds the job's lock. */
    public void replace(String jobId, JobTrackingRecord record) {
        Slot slot = slot(jobId);
        slot.record = record;
        slot.healthState = record.getHealthState();
    }

    /**
     * Jobs whose last committed record is in a missed or failed state. Takes no
     * lock, so it never waits for a check in progress.
     */
    public int incidentCount() {
        return (int) slots.values().stream()
                .map(slot -> slot.healthState)
                .filter(state -> state != null && state.isIncident())
                .count();
    }

    /** Copy of the job's record, taken under its lock. */
    public Optional<JobTrackingRecord> snapshot(String jobId) {
        Slot slot = slots.get(jobId);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            return Optional.ofNullable(slot.record).map(JobTrackingRecord::copy);
        } finally {
            slot.lock.unlock();
        }
    }

    /** Copies of every record, sorted by job id. */
    public Map<String, JobTrackingRecord> snapshotAll() {
        Map<String, JobTrackingRecord> result = new TreeMap<>();
        for (String jobId : slots.keySet()) {
            snapshot(jobId).ifPresent(record -> result.put(jobId, record));
        }
        return result;
    }

    public boolean remove(String jobId) {
        boolean removed = slots.remove(jobId) != null;
        if (removed) {
            log.info("Dropped tracking record for job {}", jobId);
        }
        return removed;
    }

    /**
     * Drops records of jobs that are no longer configured.
     *
     * @return number of records dropped
     */
    public int retainOnly(Set<String> jobIds) {
        int dropped = 0;
        for (String jobId : Set.copyOf(slots.keySet())) {
            if (!jobIds.contains(jobId) && remove(jobId)) {
                dropped++;
            }
        }
        return dropped;
    }

    public boolean contains(String jobId) {
        Slot slot = slots.get(jobId);
        return slot != null && slot.record != null;
    }

    public int size() {
        return (int) slots.values().stream().filter(slot -> slot.record != null).count();
    }

    public Collection<String> jobIds() {
        return Set.copyOf(slots.keySet());
    }

    private Slot slot(String jobId) {
        return slots.computeIfAbsent(jobId, id -> new Slot());
    }
}
