package com.hindsight.setforget.batch;

import com.hindsight.setforget.dto.SearchResult;
import com.hindsight.setforget.service.SearchMonitor;
import com.hindsight.setforget.service.SolveHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

public class JobModels {

    public enum JobStatus { PENDING, RUNNING, COMPLETED, FAILED, CANCELLED }

    public static class SearchJob implements SearchMonitor {
        public final String jobId;
        public final int fromGameweek;
        public final int toGameweek;
        public final int budget;
        public volatile JobStatus status = JobStatus.PENDING;
        public volatile String phase;
        public volatile String seasonName;
        public final AtomicInteger total = new AtomicInteger(0);
        public final AtomicInteger evaluated = new AtomicInteger(0);
        public final AtomicInteger failed = new AtomicInteger(0);
        public volatile Instant startedAt;
        public volatile Instant finishedAt;
        public volatile String error; // set when FAILED
        public volatile SearchResult result; // set when COMPLETED
        public volatile String csvFile;
        public final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

        private final List<SolveHandle> solves = Collections.synchronizedList(new ArrayList<>());
        private volatile boolean cancelRequested;

        public SearchJob(int fromGameweek, int toGameweek, int budget) {
            this.jobId = UUID.randomUUID().toString();
            this.fromGameweek = fromGameweek;
            this.toGameweek = toGameweek;
            this.budget = budget;
        }

        public void cancel() {
            cancelRequested = true;
            synchronized (solves) {
                solves.forEach(SolveHandle::cancel);
            }
        }

        public boolean isFinished() {
            return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.CANCELLED;
        }

        public long etaSeconds() {
            if (startedAt == null || evaluated.get() == 0) return -1;
            long elapsedMs = Math.max(1, Instant.now().toEpochMilli() - startedAt.toEpochMilli());
            int remaining = Math.max(0, total.get() - evaluated.get() - failed.get());
            return Math.round(remaining * (elapsedMs / (double) evaluated.get()) / 1000.0);
        }

        @Override
        public void onPhaseStarted(String phase, int candidates) {
            this.phase = phase;
        }

        @Override
        public void onCandidateEvaluated() {
            evaluated.incrementAndGet();
        }

        @Override
        public void onCandidateFailed(String reason) {
            failed.incrementAndGet();
            warnings.add(reason);
        }

        @Override
        public void onSolveStarted(SolveHandle handle) {
            solves.add(handle);
            if (cancelRequested) handle.cancel();
        }

        @Override
        public boolean isCancelled() {
            return cancelRequested;
        }
    }
}
