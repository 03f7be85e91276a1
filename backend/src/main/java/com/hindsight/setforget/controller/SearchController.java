package com.hindsight.setforget.controller;

import com.hindsight.setforget.batch.JobModels;
import com.hindsight.setforget.dto.SearchResult;
import com.hindsight.setforget.dto.SearchSummary;
import com.hindsight.setforget.dto.WeightRow;
import com.hindsight.setforget.service.OptimalSquadService;
import com.hindsight.setforget.service.SearchJobCoordinator;
import com.hindsight.setforget.service.SquadCsvExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/search")
@CrossOrigin(origins = "*")
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final SearchJobCoordinator coordinator;
    private final SquadCsvExporter csvExporter;

    public SearchController(SearchJobCoordinator coordinator, SquadCsvExporter csvExporter) {
        this.coordinator = coordinator;
        this.csvExporter = csvExporter;
    }

    @PostMapping
    public Map<String, String> start(@RequestParam(value = "fromGameweek", required = false, defaultValue = "1") int fromGameweek,
                                     @RequestParam(value = "toGameweek", required = false, defaultValue = "38") int toGameweek,
                                     @RequestParam(value = "budget", required = false) Integer budget) {
        log.info("[SearchController][START] fromGameweek={} toGameweek={} budget={}", fromGameweek, toGameweek, budget);
        try {
            String jobId = coordinator.start(fromGameweek, toGameweek, budget);
            return Map.of("jobId", jobId);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/{jobId}")
    public Map<String, Object> status(@PathVariable String jobId) {
        JobModels.SearchJob job = require(jobId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", job.jobId);
        body.put("status", job.status.toString());
        body.put("phase", job.phase);
        body.put("season", job.seasonName);
        body.put("total", job.total.get());
        body.put("evaluated", job.evaluated.get());
        body.put("failed", job.failed.get());
        body.put("startedAt", job.startedAt == null ? null : job.startedAt.toString());
        body.put("finishedAt", job.finishedAt == null ? null : job.finishedAt.toString());
        body.put("etaSeconds", job.etaSeconds());
        body.put("error", job.error);
        log.debug("[SearchController][STATUS] jobId={} status={} evaluated={}/{}", jobId, job.status, job.evaluated.get(), job.total.get());
        return body;
    }

    @GetMapping("/{jobId}/result")
    public SearchSummary result(@PathVariable String jobId) {
        return SearchSummary.of(jobId, requireResult(jobId));
    }

    @GetMapping("/{jobId}/weights")
    public List<WeightRow> weights(@PathVariable String jobId) {
        return requireResult(jobId).weights().stream().map(WeightRow::of).toList();
    }

    @GetMapping("/{jobId}/csv")
    public ResponseEntity<String> csv(@PathVariable String jobId) {
        SearchResult result = requireResult(jobId);
        String body = csvExporter.toCsv(OptimalSquadService.toRows(jobId, result.seasonName(), result.squad()));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=set_and_forget_" + result.seasonName() + ".csv")
                .contentType(new MediaType("text", "csv"))
                .body(body);
    }

    @DeleteMapping("/{jobId}")
    public Map<String, Object> cancel(@PathVariable String jobId) {
        require(jobId);
        boolean cancelled = coordinator.cancel(jobId);
        return Map.of("jobId", jobId, "cancelRequested", cancelled);
    }

    private JobModels.SearchJob require(String jobId) {
        JobModels.SearchJob job = coordinator.get(jobId);
        if (job == null) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found");
        return job;
    }

    private SearchResult requireResult(String jobId) {
        JobModels.SearchJob job = require(jobId);
        if (job.status != JobModels.JobStatus.COMPLETED || job.result == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Job " + jobId + " is " + job.status);
        }
        return job.result;
    }
}
