package taskclock.store;

import taskclock.model.JobRecord;
import taskclock.repository.JobStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile job store. Records are lost when the process exits.
 */
public class MemoryJobStore implements JobStore {

    private final Map<String, JobRecord> records = new ConcurrentHashMap<>();

    @Override
    public void put(JobRecord record) {
        records.put(record.id(), record);
    }

    @Override
    public Optional<JobRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public boolean remove(String id) {
        return records.remove(id) != null;
    }

    @Override
    public void removeAll() {
        records.clear();
    }

    @Override
    public List<JobRecord> list() {
        return records.values().stream()
                .sorted(Comparator.comparing(JobRecord::id))
                .toList();
    }

    @Override
    public String describe() {
        return "memory";
    }

    @Override
    public void close() {
        records.clear();
    }
}
