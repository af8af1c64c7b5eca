package net.jobsy.core.spi;

import net.jobsy.core.model.Job;
import net.jobsy.core.model.JobDefinition;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface JobRepository {
    List<Job> findActive() throws Exception;
    List<Job> findAll() throws Exception;   // newest first
    Optional<Job> findById(UUID id) throws Exception;
    Optional<Job> findByName(String name) throws Exception;

    /** Row lock held until the surrounding transaction ends (SELECT ... FOR UPDATE). */
    Optional<Job> lockById(UUID id) throws Exception;

    /**
     * Writes the evaluation fields back. Fails with
     * {@link net.jobsy.core.exception.StorePersistenceException} when {@code job.version()}
     * no longer matches the stored row.
     */
    void save(Job job) throws Exception;

    /** Create-or-update by name (administrative path). Evaluation fields are left untouched. */
    Job upsert(JobDefinition definition) throws Exception;
}
