package com.phillippitts.satupscale.service.orchestration;

import com.phillippitts.satupscale.exception.JobNotFoundException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory index of submitted jobs by id. */
@Component
public class JobRegistry {

    private final Map<String, JobRecord> records = new ConcurrentHashMap<>();

    void register(JobRecord record) {
        if (records.putIfAbsent(record.jobId(), record) != null) {
            throw new IllegalStateException("Duplicate job id " + record.jobId());
        }
    }

    public Optional<JobRecord> find(String jobId) {
        return Optional.ofNullable(records.get(jobId));
    }

    /**
     * @throws JobNotFoundException if no job has this id
     */
    public JobRecord require(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public int size() {
        return records.size();
    }
}
