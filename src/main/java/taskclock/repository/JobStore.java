package taskclock.repository;

import taskclock.model.JobRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for scheduled jobs, keyed by job id.
 *
 * Every operation is atomic per record. After a mutating call returns, a
 * following {@link #list()} or {@link #get(String)} from the same process
 * observes it, whatever the backend.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Insert the record or replace the one with the same id.
     *
     * @param record the record to store
     */
    void put(JobRecord record);

    /**
     * Find a record by id.
     *
     * @param id the job id
     * @return the record if present
     */
    Optional<JobRecord> get(String id);

    /**
     * Delete a record.
     *
     * @param id the job id
     * @return true if a record was deleted
     */
    boolean remove(String id);

    /**
     * Delete every record in this store's namespace.
     */
    void removeAll();

    /**
     * All records, ordered by id.
     */
    List<JobRecord> list();

    /**
     * Check whether the backend is reachable.
     */
    default boolean isHealthy() {
        return true;
    }

    /** Short description of the backend for logs and health output. */
    String describe();

    @Override
    void close();
}
