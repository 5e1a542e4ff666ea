package io.cronhub.core.job;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobStore {
    JobRecord create(JobDraft draft) throws IOException;

    Optional<JobRecord> get(long id) throws IOException;

    List<JobRecord> list() throws IOException;

    List<JobRecord> listEnabled() throws IOException;

    Optional<JobRecord> update(long id, JobPatch patch) throws IOException;

    boolean delete(long id) throws IOException;

    /**
     * Records a completed run. Returns {@code false} when the job is gone or already holds a later timestamp.
     */
    boolean setLastRun(long id, Instant completedAt) throws IOException;
}
