package com.hindsight.setforget.service;

import com.hindsight.setforget.batch.InMemoryJobStore;
import com.hindsight.setforget.batch.JobModels;
import com.hindsight.setforget.config.SearchSettings;
import com.hindsight.setforget.dto.SearchResult;
import com.hindsight.setforget.model.OptimalSquadMember;
import com.hindsight.setforget.registry.PlayerRegistry;
import com.hindsight.setforget.registry.SeasonSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs hindsight searches as background jobs: load the season once, search, then store and export the squad.
 */
@Service
public class SearchJobCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SearchJobCoordinator.class);

    private final PlayerRegistry registry;
    private final SquadOptimizerService optimizer;
    private final SearchSettings settings;
    private final InMemoryJobStore jobStore;
    private final Executor jobExecutor;
    private final Executor searchExecutor;
    private final OptimalSquadService optimalSquadService;
    private final SquadCsvExporter csvExporter;

    public SearchJobCoordinator(PlayerRegistry registry,
                                SquadOptimizerService optimizer,
                                SearchSettings settings,
                                InMemoryJobStore jobStore,
                                @Qualifier("searchJobExecutor") Executor jobExecutor,
                                @Qualifier("searchExecutor") Executor searchExecutor,
                                OptimalSquadService optimalSquadService,
                                SquadCsvExporter csvExporter) {
        this.registry = registry;
        this.optimizer = optimizer;
        this.settings = settings;
        this.jobStore = jobStore;
        this.jobExecutor = jobExecutor;
        this.searchExecutor = searchExecutor;
        this.optimalSquadService = optimalSquadService;
        this.csvExporter = csvExporter;
    }

    public String start(int fromGameweek, int toGameweek, Integer budget) {
        if (fromGameweek < 1 || toGameweek < fromGameweek) {
            throw new IllegalArgumentException("Invalid gameweek range [" + fromGameweek + ", " + toGameweek + "]");
        }
        int effectiveBudget = budget != null ? budget : settings.getBudget();
        if (effectiveBudget <= 0) throw new IllegalArgumentException("Budget must be positive, was " + effectiveBudget);

        JobModels.SearchJob job = new JobModels.SearchJob(fromGameweek, toGameweek, effectiveBudget);
        jobStore.register(job);
        log.info("[SearchJob][Queued] jobId={} gameweeks=[{}, {}] budget={} unfinished={}",
                job.jobId, fromGameweek, toGameweek, effectiveBudget, jobStore.countUnfinished());
        CompletableFuture.runAsync(() -> process(job), jobExecutor);
        return job.jobId;
    }

    void process(JobModels.SearchJob job) {
        job.status = JobModels.JobStatus.RUNNING;
        job.startedAt = Instant.now();
        try {
            SeasonSnapshot snapshot = registry.snapshot(job.fromGameweek, job.toGameweek);
            job.seasonName = snapshot.getSeasonName();
            SearchOrchestrator orchestrator = new SearchOrchestrator(snapshot, optimizer, settings.withBudget(job.budget), searchExecutor);
            job.total.set(orchestrator.plannedCandidates());
            log.info("[SearchJob][Start] jobId={} season={} players={} lastCompleted={} candidates={}",
                    job.jobId, snapshot.getSeasonName(), snapshot.getPlayers().size(),
                    snapshot.getLastCompletedGameweek(), job.total.get());

            SearchResult result = orchestrator.run(job);
            List<OptimalSquadMember> rows = optimalSquadService.save(job.jobId, result);
            Path csv = csvExporter.export(result.seasonName(), rows);

            job.result = result;
            job.csvFile = csv.toString();
            job.status = JobModels.JobStatus.COMPLETED;
            log.info("[SearchJob][Done] jobId={} weight={} phaseOneTotal={} total={} failedCandidates={}",
                    job.jobId, result.weight(), result.phaseOneTotal(), result.totalPoints(), job.failed.get());
        } catch (CancellationException e) {
            job.status = JobModels.JobStatus.CANCELLED;
            log.info("[SearchJob][Cancelled] jobId={} evaluated={}", job.jobId, job.evaluated.get());
        } catch (Exception e) {
            job.error = e.getClass().getSimpleName() + ": " + e.getMessage();
            job.status = JobModels.JobStatus.FAILED;
            log.error("Search job failed jobId={}: {}", job.jobId, e.getMessage(), e);
        } finally {
            job.finishedAt = Instant.now();
        }
    }

    public JobModels.SearchJob get(String jobId) { return jobStore.find(jobId).orElse(null); }

    /** Requests cancellation; returns false when the job is unknown or already finished. */
    public boolean cancel(String jobId) {
        JobModels.SearchJob job = jobStore.find(jobId).orElse(null);
        if (job == null || job.isFinished()) return false;
        job.cancel();
        log.info("[SearchJob][CancelRequested] jobId={}", jobId);
        return true;
    }
}
