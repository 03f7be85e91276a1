package com.hindsight.setforget.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Search jobs kept in memory for polling. A finished job stays visible for the retention window and is
 * evicted after it; a job that has not finished is never evicted.
 */
@Component
public class InMemoryJobStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final Map<String, JobModels.SearchJob> jobsById = new ConcurrentHashMap<>();
    private final Duration retention;

    public InMemoryJobStore(@Value("${hindsight.jobs.retention-hours:24}") long retentionHours) {
        if (retentionHours <= 0) {
            throw new IllegalArgumentException("Job retention must be at least one hour, was " + retentionHours);
        }
        this.retention = Duration.ofHours(retentionHours);
    }

    public void register(JobModels.SearchJob job) {
        JobModels.SearchJob previous = jobsById.putIfAbsent(job.jobId, job);
        if (previous != null) throw new IllegalStateException("Search job already registered: " + job.jobId);
    }

    public Optional<JobModels.SearchJob> find(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobsById.get(jobId));
    }

    /** Jobs queued or running, whether or not cancellation was requested. */
    public long countUnfinished() {
        return jobsById.values().stream().filter(j -> !j.isFinished()).count();
    }

    public Duration getRetention() { return retention; }

    @Scheduled(cron = "${hindsight.jobs.cleanup-cron:0 0 * * * *}")
    public void evictExpired() {
        evictFinishedBefore(Instant.now().minus(retention));
    }

    int evictFinishedBefore(Instant cutoff) {
        int evicted = 0;
        for (JobModels.SearchJob job : jobsById.values()) {
            if (job.isFinished() && job.finishedAt != null && job.finishedAt.isBefore(cutoff)
                    && jobsById.remove(job.jobId, job)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("[JobStore][Evict] removed={} remaining={} cutoff={}", evicted, jobsById.size(), cutoff);
        }
        return evicted;
    }
}
